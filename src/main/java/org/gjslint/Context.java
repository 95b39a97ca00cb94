package org.gjslint;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

/**
 * Node of the structural tree of one file. Parent and children are kept as handles into the owning
 * {@link ContextTree}.
 */
public final class Context
{
	public static enum Type
	{
		// The root context.
		ROOT("root"),
		// A block of code.
		BLOCK("block"),
		// A pseudo-block of code for a given case or default section.
		CASE_BLOCK("case_block"),
		// Block of statements in a for loop's parentheses.
		FOR_GROUP_BLOCK("for_block"),
		// An implied block of code for one line if, while and for statements.
		IMPLIED_BLOCK("implied_block"),
		// An index in to an array or object.
		INDEX("index"),
		// An array literal in [].
		ARRAY_LITERAL("array_literal"),
		// An object literal in {}.
		OBJECT_LITERAL("object_literal"),
		// An individual element in an array or object literal.
		LITERAL_ELEMENT("literal_element"),
		// The portion of a ternary statement between ? and :
		TERNARY_TRUE("ternary_true"),
		// The portion of a ternary statement after :
		TERNARY_FALSE("ternary_false"),
		// The entire switch statement. Its BLOCK can only contain case and default sections.
		SWITCH("switch"),
		COMMENT("comment"),
		DOC("doc"),
		// An individual statement.
		STATEMENT("statement"),
		// Code within parentheses.
		GROUP("group"),
		// Parameter names in a function declaration.
		PARAMETERS("parameters"),
		// A set of variable declarations after var, let or const.
		VAR("var");

		private final String value;

		Type(String value)
		{
			this.value = value;
		}

		@Override
		public String toString()
		{
			return value;
		}
	}

	public static final Set<Type> BLOCK_TYPES = ImmutableSet.of(
		Type.ROOT, Type.BLOCK, Type.CASE_BLOCK, Type.FOR_GROUP_BLOCK, Type.IMPLIED_BLOCK);

	private final ContextTree tree;
	private final int handle;
	private final Type type;
	private Token startToken = null;
	private Token endToken = null;
	private int parentHandle = ContextTree.NO_CONTEXT;
	private final List<Integer> childHandles = new ArrayList<>();

	Context(ContextTree tree, int handle, Type type, Token startToken)
	{
		this.tree = tree;
		this.handle = handle;
		this.type = type;
		this.startToken = startToken;
	}

	public int getHandle()
	{
		return handle;
	}

	public Type getType()
	{
		return type;
	}

	public boolean isType(Type type)
	{
		return this.type == type;
	}

	public Token getStartToken()
	{
		return startToken;
	}

	void setStartToken(Token startToken)
	{
		this.startToken = startToken;
	}

	public Token getEndToken()
	{
		return endToken;
	}

	/**
	 * End token is assigned once, when the context is popped.
	 */
	void setEndToken(Token endToken)
	{
		if (this.endToken == null)
		{
			this.endToken = endToken;
		}
	}

	public int getParentHandle()
	{
		return parentHandle;
	}

	void setParentHandle(int parentHandle)
	{
		this.parentHandle = parentHandle;
	}

	public Context getParent()
	{
		return tree.get(parentHandle);
	}

	/**
	 * Children in order of their start tokens.
	 */
	public List<Context> getChildren()
	{
		return Lists.transform(childHandles, tree::get);
	}

	void addChildHandle(int childHandle)
	{
		Token childStart = tree.get(childHandle).getStartToken();
		int position = childHandles.size();
		while (position > 0 && childStart != null)
		{
			Token previousStart = tree.get(childHandles.get(position - 1)).getStartToken();
			if (previousStart == null || previousStart.getIndex() <= childStart.getIndex())
			{
				break;
			}
			position--;
		}
		childHandles.add(position, childHandle);
	}

	/**
	 * Returns the root context that contains this context.
	 */
	public Context getRoot()
	{
		Context context = this;
		while (context != null && context.type != Type.ROOT)
		{
			context = context.getParent();
		}
		return context;
	}

	@Override
	public String toString()
	{
		List<Type> stack = new ArrayList<>();
		for (Context context = this; context != null; context = context.getParent())
		{
			stack.add(context.type);
		}
		return "Context(" + Joiner.on(" > ").join(stack) + ")";
	}
}
