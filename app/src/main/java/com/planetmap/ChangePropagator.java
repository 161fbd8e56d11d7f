package com.planetmap;

import java.lang.ref.Reference;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Fans a value out to subscribers that are only weakly referenced. A subscriber
 * that has been garbage collected is dropped the next time a value is published.
 *
 * Confined to the event dispatch thread; there is no internal synchronization.
 * Subscribers must not publish on the same propagator from inside {@link Subscriber#onChange}.
 */
public class ChangePropagator<T>
{
	private final List<Reference<? extends Subscriber<T>>> subscribers = new ArrayList<>();
	private boolean notifying;

	/**
	 * Registers {@code subscriber} without keeping it alive. Adding the same
	 * subscriber twice delivers every value to it twice.
	 */
	public void add(Subscriber<T> subscriber)
	{
		add(new WeakReference<>(subscriber));
	}

	void add(Reference<? extends Subscriber<T>> reference)
	{
		subscribers.add(reference);
	}

	public void notifySubscribers(T value)
	{
		if (notifying)
		{
			throw new IllegalStateException("nested notification on the same propagator");
		}
		notifying = true;
		try
		{
			Iterator<Reference<? extends Subscriber<T>>> it = subscribers.iterator();
			while (it.hasNext())
			{
				Subscriber<T> subscriber = it.next().get();
				if (subscriber == null)
				{
					it.remove();
				}
				else
				{
					subscriber.onChange(value);
				}
			}
		}
		finally
		{
			notifying = false;
		}
	}

	int size()
	{
		return subscribers.size();
	}
}
