package org.xmliter.count;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The number of elements found at each {@link PathKey} of a document. Paths iterate in the order they were first seen. Every count is at
 * least 1.
 */
public class EdgeCountTable {
	private final Map<PathKey, Long> theCounts;
	private long theTotal;

	/** Creates an empty table */
	public EdgeCountTable() {
		theCounts = new LinkedHashMap<>();
	}

	/**
	 * Counts one more element at the given path
	 *
	 * @param path The path of the element
	 * @return The new count for the path
	 */
	public long increment(PathKey path) {
		theTotal++;
		return theCounts.merge(path, 1L, Long::sum);
	}

	/**
	 * @param path The path to get the count for
	 * @return The number of elements counted at the path, 0 if there were none
	 */
	public long getCount(PathKey path) {
		Long count = theCounts.get(path);
		return count == null ? 0 : count;
	}

	/**
	 * @param tags The tag names from the root down
	 * @return The number of elements counted at the path, 0 if there were none
	 */
	public long getCount(String... tags) {
		return getCount(PathKey.of(tags));
	}

	/** @return The number of elements counted, across all paths */
	public long getTotal() {
		return theTotal;
	}

	/** @return The number of distinct paths counted */
	public int size() {
		return theCounts.size();
	}

	/** @return Whether nothing has been counted */
	public boolean isEmpty() {
		return theCounts.isEmpty();
	}

	/** @return An unmodifiable view of the counts by path, in first-seen order */
	public Map<PathKey, Long> asMap() {
		return Collections.unmodifiableMap(theCounts);
	}

	@Override
	public int hashCode() {
		return theCounts.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof EdgeCountTable && theCounts.equals(((EdgeCountTable) obj).theCounts);
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder();
		for (Map.Entry<PathKey, Long> entry : theCounts.entrySet()) {
			if (str.length() > 0)
				str.append('\n');
			str.append(entry.getKey()).append(": ").append(entry.getValue());
		}
		return str.toString();
	}
}
