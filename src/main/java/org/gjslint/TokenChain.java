package org.gjslint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered arena of all tokens of one file. Previous and next tokens are addressed as index -1 and +1.
 */
public final class TokenChain implements Iterable<Token>
{
	private final List<Token> tokens = new ArrayList<>();

	void add(Token token)
	{
		token.attach(this, tokens.size());
		tokens.add(token);
	}

	public Token get(int index)
	{
		return (index >= 0 && index < tokens.size()) ? tokens.get(index) : null;
	}

	public Token previous(int index)
	{
		return get(index - 1);
	}

	public Token next(int index)
	{
		return get(index + 1);
	}

	public Token getFirst()
	{
		return get(0);
	}

	public Token getLast()
	{
		return get(tokens.size() - 1);
	}

	public int size()
	{
		return tokens.size();
	}

	public boolean isEmpty()
	{
		return tokens.isEmpty();
	}

	public List<Token> getTokens()
	{
		return Collections.unmodifiableList(tokens);
	}

	@Override
	public Iterator<Token> iterator()
	{
		return getTokens().iterator();
	}
}
