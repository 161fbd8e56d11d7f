package com.planetmap;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns the open dependent views under stable ids. Views subscribe to the session
 * weakly, so removing a view here is what ends its subscriptions.
 */
class ViewRegistry<V>
{
	private final Map<Integer, V> views = new LinkedHashMap<>();
	private int nextId = 1;

	int add(V view)
	{
		int id = nextId++;
		views.put(id, view);
		return id;
	}

	V get(int id)
	{
		return views.get(id);
	}

	V remove(int id)
	{
		return views.remove(id);
	}

	Collection<V> views()
	{
		return Collections.unmodifiableCollection(views.values());
	}

	int size()
	{
		return views.size();
	}
}
