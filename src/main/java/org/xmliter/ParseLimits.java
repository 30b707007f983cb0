package org.xmliter;

import java.util.Objects;

/**
 * Bounds on how much of a document an {@link XmlEventIterator} yields. A null limit is unbounded. Instances are immutable.
 */
public final class ParseLimits {
	/** The system property read by {@link #fromSystemProperties()} for the maximum depth */
	public static final String MAX_DEPTH_PROPERTY = "xmliter.maxDepth";
	/** The system property read by {@link #fromSystemProperties()} for the maximum number of events */
	public static final String MAX_EVENTS_PROPERTY = "xmliter.maxEvents";

	/** Limits that yield the whole document */
	public static final ParseLimits UNBOUNDED = new ParseLimits(null, null);

	private final Integer theMaxDepth;
	private final Long theMaxEvents;

	private ParseLimits(Integer maxDepth, Long maxEvents) {
		if (maxDepth != null && maxDepth < 0)
			throw new IllegalArgumentException("Maximum depth must not be negative: " + maxDepth);
		if (maxEvents != null && maxEvents < 0)
			throw new IllegalArgumentException("Maximum event count must not be negative: " + maxEvents);
		theMaxDepth = maxDepth;
		theMaxEvents = maxEvents;
	}

	/**
	 * @param maxDepth The deepest element nesting level to yield (the root is level 1), or null for no limit
	 * @param maxEvents The maximum number of events to yield, or null for no limit
	 * @return The limits
	 */
	public static ParseLimits of(Integer maxDepth, Long maxEvents) {
		if (maxDepth == null && maxEvents == null)
			return UNBOUNDED;
		return new ParseLimits(maxDepth, maxEvents);
	}

	/**
	 * Reads limits from the {@value #MAX_DEPTH_PROPERTY} and {@value #MAX_EVENTS_PROPERTY} system properties. An absent or blank property
	 * is unbounded.
	 *
	 * @return The configured limits
	 * @throws IllegalArgumentException If either property is not a non-negative integer
	 */
	public static ParseLimits fromSystemProperties() throws IllegalArgumentException {
		String depth = System.getProperty(MAX_DEPTH_PROPERTY);
		String events = System.getProperty(MAX_EVENTS_PROPERTY);
		Long maxDepth = parseProperty(MAX_DEPTH_PROPERTY, depth);
		if (maxDepth != null && maxDepth > Integer.MAX_VALUE)
			throw new IllegalArgumentException(MAX_DEPTH_PROPERTY + " is too large: " + depth);
		return of(maxDepth == null ? null : Integer.valueOf(maxDepth.intValue()), parseProperty(MAX_EVENTS_PROPERTY, events));
	}

	private static Long parseProperty(String property, String value) {
		if (value == null || value.trim().isEmpty())
			return null;
		long parsed;
		try {
			parsed = Long.parseLong(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(property + " must be a non-negative integer, not '" + value + "'", e);
		}
		if (parsed < 0)
			throw new IllegalArgumentException(property + " must be a non-negative integer, not '" + value + "'");
		return parsed;
	}

	/** @return The deepest element nesting level to yield (the root is level 1), or null for no limit */
	public Integer getMaxDepth() {
		return theMaxDepth;
	}

	/** @return The maximum number of events to yield, or null for no limit */
	public Long getMaxEvents() {
		return theMaxEvents;
	}

	/** @return Whether neither limit is set */
	public boolean isUnbounded() {
		return theMaxDepth == null && theMaxEvents == null;
	}

	/**
	 * @param maxDepth The maximum depth for the new limits, or null for no limit
	 * @return Limits like these, but with the given maximum depth
	 */
	public ParseLimits withMaxDepth(Integer maxDepth) {
		return of(maxDepth, theMaxEvents);
	}

	/**
	 * @param maxEvents The maximum event count for the new limits, or null for no limit
	 * @return Limits like these, but with the given maximum event count
	 */
	public ParseLimits withMaxEvents(Long maxEvents) {
		return of(theMaxDepth, maxEvents);
	}

	@Override
	public int hashCode() {
		return Objects.hash(theMaxDepth, theMaxEvents);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ParseLimits && Objects.equals(theMaxDepth, ((ParseLimits) obj).theMaxDepth)
			&& Objects.equals(theMaxEvents, ((ParseLimits) obj).theMaxEvents);
	}

	@Override
	public String toString() {
		if (isUnbounded())
			return "unbounded";
		StringBuilder str = new StringBuilder();
		if (theMaxDepth != null)
			str.append("maxDepth=").append(theMaxDepth);
		if (theMaxEvents != null) {
			if (str.length() > 0)
				str.append(", ");
			str.append("maxEvents=").append(theMaxEvents);
		}
		return str.toString();
	}
}
