package org.gjslint;

import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.gjslint.utils.TokenUtil;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * A single '@flag' of a doc comment: its type expression, parameter name and description, all read by
 * scanning forward from the flag token.
 */
public class DocFlag
{
	// Please keep these lists alphabetized.

	public static final Set<String> STANDARD_DOC = ImmutableSet.of(
		"author", "bug", "classTemplate", "consistentIdGenerator", "const", "constructor", "define", "deprecated",
		"dict", "enum", "export", "expose", "extends", "externs", "fileoverview", "idGenerator", "implements",
		"implicitCast", "interface", "lends", "license", "ngInject", "noalias", "nocompile", "nosideeffects",
		"override", "owner", "param", "preserve", "private", "protected", "public", "return", "see",
		"stableIdGenerator", "struct", "supported", "template", "this", "type", "typedef", "wizaction", "wizmodule");

	public static final Set<String> ANNOTATION = ImmutableSet.of("preserveTry", "suppress");

	// JavaScript specific tags.
	public static final Set<String> EXTENDED_DOC = ImmutableSet.of(
		"class", "code", "desc", "final", "hidden", "inheritDoc", "link", "meaning", "provideGoog", "throws");

	public static final Set<String> LEGAL_DOC = ImmutableSet.copyOf(
		Sets.union(Sets.union(STANDARD_DOC, ANNOTATION), EXTENDED_DOC));

	public static final Set<String> HAS_DESCRIPTION = ImmutableSet.of(
		"define", "deprecated", "desc", "fileoverview", "license", "param", "preserve", "return", "supported");

	public static final Set<String> HAS_TYPE = ImmutableSet.of(
		"const", "define", "enum", "extends", "implements", "param", "return", "suppress", "type");

	// Flags whose type may also be written without braces on the same line.
	public static final Set<String> TYPE_ONLY = ImmutableSet.of(
		"const", "enum", "extends", "implements", "suppress", "type");

	public static final Set<String> HAS_NAME = ImmutableSet.of("param");

	private final Token flagToken;
	private final String flagType;

	private String type = null;
	private Token typeStartToken = null;
	private Token typeEndToken = null;
	private boolean malformedType = false;

	private Token nameToken = null;
	private String name = null;

	private Token descriptionStartToken = null;
	private Token descriptionEndToken = null;
	private String description = null;

	public DocFlag(Token flagToken)
	{
		this.flagToken = flagToken;
		this.flagType = StringUtils.stripStart(flagToken.getString().trim(), "@");

		parseType();
		parseName();
		parseDescription();
	}

	private void parseType()
	{
		if (!HAS_TYPE.contains(flagType))
		{
			return;
		}

		Token brace = TokenUtil.searchUntil(flagToken, ImmutableSet.of(TokenType.DOC_START_BRACE),
			TokenType.FLAG_ENDING_TYPES, TokenUtil.UNBOUNDED, false);
		if (brace != null)
		{
			BraceContents braceContents = getMatchingEndBraceAndContents(brace);
			type = braceContents.contents;
			typeStartToken = brace;
			typeEndToken = braceContents.endToken;
			malformedType = !braceContents.closed;
			return;
		}

		// Without braces the type can only be on the same line as the flag.
		Token next = flagToken.getNext();
		if (TYPE_ONLY.contains(flagType) && next != null && !next.isAnyType(TokenType.FLAG_ENDING_TYPES)
			&& next.getLineNumber() == flagToken.getLineNumber())
		{
			typeStartToken = next;
			EndTokenAndContents endAndContents = getEndTokenAndContents(typeStartToken);
			typeEndToken = endAndContents.endToken;
			type = StringUtils.trim(endAndContents.contents);
		}
	}

	private void parseName()
	{
		if (!HAS_NAME.contains(flagType))
		{
			return;
		}

		// Name may be right after the flag when there is no type.
		nameToken = getNextPartialIdentifierToken(flagToken);

		// A name found inside the type is a part of the type, the real name comes after the type.
		if (type != null && nameToken != null && TokenUtil.compare(nameToken, typeStartToken) > 0)
		{
			nameToken = getNextPartialIdentifierToken(typeEndToken);
		}

		if (nameToken != null)
		{
			name = nameToken.getString();
		}
	}

	private void parseDescription()
	{
		if (!HAS_DESCRIPTION.contains(flagType))
		{
			return;
		}

		Token searchStartToken = flagToken;
		if (nameToken != null && typeEndToken != null)
		{
			searchStartToken = TokenUtil.compare(typeEndToken, nameToken) > 0 ? typeEndToken : nameToken;
		}
		else if (nameToken != null)
		{
			searchStartToken = nameToken;
		}
		else if (type != null && typeEndToken != null)
		{
			searchStartToken = typeEndToken;
		}

		Token interestingToken = TokenUtil.search(searchStartToken,
			Sets.union(TokenType.FLAG_DESCRIPTION_TYPES, TokenType.FLAG_ENDING_TYPES), TokenUtil.UNBOUNDED, false);
		if (interestingToken != null && interestingToken.isAnyType(TokenType.FLAG_DESCRIPTION_TYPES))
		{
			descriptionStartToken = interestingToken;
			EndTokenAndContents endAndContents = getEndTokenAndContents(interestingToken);
			descriptionEndToken = endAndContents.endToken;
			description = endAndContents.contents;
		}
	}

	public Token getFlagToken()
	{
		return flagToken;
	}

	public String getFlagType()
	{
		return flagType;
	}

	public String getType()
	{
		return type;
	}

	public Token getTypeStartToken()
	{
		return typeStartToken;
	}

	public Token getTypeEndToken()
	{
		return typeEndToken;
	}

	/**
	 * Whether the type starts with '{' but the flag or the comment ends before the matching '}'.
	 */
	public boolean isMalformedType()
	{
		return malformedType;
	}

	public Token getNameToken()
	{
		return nameToken;
	}

	public String getName()
	{
		return name;
	}

	public Token getDescriptionStartToken()
	{
		return descriptionStartToken;
	}

	public Token getDescriptionEndToken()
	{
		return descriptionEndToken;
	}

	public String getDescription()
	{
		return description;
	}

	public boolean isLegal()
	{
		return LEGAL_DOC.contains(flagType);
	}

	@Override
	public String toString()
	{
		return "<DocFlag: @" + flagType + (type != null ? " {" + type + "}" : "") + (name != null ? " " + name : "")
			+ ">";
	}

	static final class BraceContents
	{
		final Token endToken;
		final String contents;
		final boolean closed;

		BraceContents(Token endToken, String contents, boolean closed)
		{
			this.endToken = endToken;
			this.contents = contents;
			this.closed = closed;
		}
	}

	static final class EndTokenAndContents
	{
		final Token endToken;
		final String contents;

		EndTokenAndContents(Token endToken, String contents)
		{
			this.endToken = endToken;
			this.contents = contents;
		}
	}

	/**
	 * Returns the matching end brace and the text between the braces without comment prefixes. When a flag
	 * ending token comes before the matching brace, the token before it is returned instead.
	 */
	static BraceContents getMatchingEndBraceAndContents(Token startBrace)
	{
		int openCount = 1;
		int closeCount = 0;
		StringBuilder contents = new StringBuilder();

		// The start brace is not part of the type.
		Token token = startBrace.getNext();
		Token last = startBrace;
		boolean closed = false;

		while (token != null)
		{
			if (token.isType(TokenType.DOC_START_BRACE))
			{
				openCount++;
			}
			else if (token.isType(TokenType.DOC_END_BRACE))
			{
				closeCount++;
			}

			if (openCount == closeCount)
			{
				closed = true;
				last = token;
				break;
			}

			if (token.isAnyType(TokenType.FLAG_ENDING_TYPES))
			{
				break;
			}

			if (!token.isType(TokenType.DOC_PREFIX))
			{
				contents.append(token.getString());
			}

			last = token;
			token = token.getNext();
		}

		return new BraceContents(last, contents.toString(), closed);
	}

	/**
	 * Returns the first comment token after the start token that contains an identifier. The search stops at a
	 * flag ending token.
	 */
	static Token getNextPartialIdentifierToken(Token startToken)
	{
		for (Token token = startToken.getNext(); token != null && !token.isAnyType(TokenType.FLAG_ENDING_TYPES);
			token = token.getNext())
		{
			if (token.isType(TokenType.COMMENT) && Reg.IDENTIFIER.matcher(token.getString()).find())
			{
				return token;
			}
		}
		return null;
	}

	/**
	 * Collects description text from the start token up to the next flag, the end of the comment or an empty
	 * comment line.
	 */
	static EndTokenAndContents getEndTokenAndContents(Token startToken)
	{
		Token iterator = startToken;
		int lastLine = iterator.getLineNumber();
		Token lastToken = null;
		StringBuilder contents = new StringBuilder();
		int docDepth = 0;

		while (iterator != null && (!iterator.isAnyType(TokenType.FLAG_ENDING_TYPES) || docDepth > 0))
		{
			// An empty comment line ends the description:
			// * @return {boolean} True
			// *
			// * Note: This is a sentence.
			if (iterator.isFirstInLine() && Reg.EMPTY_COMMENT_LINE.matcher(iterator.getLine()).matches())
			{
				break;
			}

			// Inline flags like {@code x} may contain '@', they do not end the description.
			Token next = iterator.getNext();
			if (iterator.isType(TokenType.DOC_START_BRACE) && next != null && next.isType(TokenType.DOC_INLINE_FLAG))
			{
				docDepth++;
			}
			else if (iterator.isType(TokenType.DOC_END_BRACE) && docDepth > 0)
			{
				docDepth--;
			}

			if (iterator.isAnyType(TokenType.FLAG_DESCRIPTION_TYPES))
			{
				contents.append(iterator.getString());
				lastToken = iterator;
			}

			iterator = next;
			if (iterator != null && iterator.getLineNumber() != lastLine)
			{
				contents.append('\n');
				lastLine = iterator.getLineNumber();
			}
		}

		String text = contents.toString();
		return new EndTokenAndContents(lastToken, StringUtils.isBlank(text) ? null : text.trim());
	}
}
