package org.xmliter;

import java.util.Objects;

import org.xmliter.io.XmlEvent;

/** An {@link XmlEvent} as yielded by an {@link XmlEventIterator}, numbered in yield order starting at 1 */
public final class EventRecord {
	private final long theSequence;
	private final XmlEvent theEvent;

	/**
	 * @param sequence The 1-based position of the event among the events yielded
	 * @param event The event
	 */
	public EventRecord(long sequence, XmlEvent event) {
		if (sequence < 1)
			throw new IllegalArgumentException("Sequence must be positive: " + sequence);
		theSequence = sequence;
		theEvent = Objects.requireNonNull(event, "event");
	}

	/** @return The 1-based position of the event among the events yielded */
	public long getSequence() {
		return theSequence;
	}

	/** @return The event */
	public XmlEvent getEvent() {
		return theEvent;
	}

	/** @return "start", "end" or "text" */
	public String getKind() {
		return theEvent.getType().kind;
	}

	/** @return The tag name for start and end events, the content for text events */
	public String getValue() {
		return theEvent.getValue();
	}

	@Override
	public int hashCode() {
		return Long.hashCode(theSequence) * 31 + theEvent.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof EventRecord && theSequence == ((EventRecord) obj).theSequence && theEvent.equals(((EventRecord) obj).theEvent);
	}

	@Override
	public String toString() {
		return "(" + theSequence + ", " + getKind() + ", " + getValue() + ")";
	}
}
