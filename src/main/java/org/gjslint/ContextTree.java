package org.gjslint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Arena of all contexts built for one file. Contexts refer to each other by their handles, which are
 * indexes in this arena. The root context always has handle 0.
 */
public final class ContextTree
{
	public static final int NO_CONTEXT = -1;

	private final List<Context> contexts = new ArrayList<>();

	Context create(Context.Type type, Token startToken, Context parent)
	{
		Context context = new Context(this, contexts.size(), type, startToken);
		contexts.add(context);

		if (parent != null)
		{
			context.setParentHandle(parent.getHandle());
			parent.addChildHandle(context.getHandle());
		}
		return context;
	}

	public Context get(int handle)
	{
		return (handle >= 0 && handle < contexts.size()) ? contexts.get(handle) : null;
	}

	public Context getRoot()
	{
		return get(0);
	}

	public int size()
	{
		return contexts.size();
	}

	/**
	 * All contexts in order of creation.
	 */
	public List<Context> getContexts()
	{
		return Collections.unmodifiableList(contexts);
	}

	public List<Context> getContexts(Context.Type type)
	{
		return contexts.stream().filter(c -> c.isType(type)).collect(Collectors.toList());
	}
}
