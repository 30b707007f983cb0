package org.xmliter.count;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

/** The tag names from a document's root element down to an element, inclusive. Attributes play no part in a key. */
public final class PathKey implements Comparable<PathKey> {
	private final ImmutableList<String> theTags;
	private final int theHashCode;

	private PathKey(ImmutableList<String> tags) {
		if (tags.isEmpty())
			throw new IllegalArgumentException("A path must contain at least one tag");
		theTags = tags;
		theHashCode = tags.hashCode();
	}

	/**
	 * @param tags The tag names from the root down
	 * @return The path
	 */
	public static PathKey of(String... tags) {
		return new PathKey(ImmutableList.copyOf(tags));
	}

	/**
	 * @param tags The tag names from the root down
	 * @return The path
	 */
	public static PathKey of(List<String> tags) {
		return new PathKey(ImmutableList.copyOf(tags));
	}

	/**
	 * @param path The '/'-separated tag names from the root down, e.g. "catalog/book/title"
	 * @return The path
	 */
	public static PathKey parse(String path) {
		return of(Arrays.asList(path.split("/", -1)));
	}

	/**
	 * @param tag The name of the child element
	 * @return The path of a child of this path's element
	 */
	public PathKey child(String tag) {
		return new PathKey(ImmutableList.<String> builderWithExpectedSize(theTags.size() + 1).addAll(theTags).add(tag).build());
	}

	/** @return The path of this path's element's parent, or null if this is a root path */
	public PathKey getParent() {
		if (theTags.size() == 1)
			return null;
		return new PathKey(theTags.subList(0, theTags.size() - 1));
	}

	/** @return The name of the element this path ends with */
	public String getLeaf() {
		return theTags.get(theTags.size() - 1);
	}

	/** @return The name of the root element */
	public String getRoot() {
		return theTags.get(0);
	}

	/** @return The number of tags in this path, 1 for the root element */
	public int getDepth() {
		return theTags.size();
	}

	/** @return The tag names from the root down */
	public ImmutableList<String> getTags() {
		return theTags;
	}

	/**
	 * @param other The other path
	 * @return Whether this path is the given path or one of its descendants
	 */
	public boolean startsWith(PathKey other) {
		return other.theTags.size() <= theTags.size() && theTags.subList(0, other.theTags.size()).equals(other.theTags);
	}

	@Override
	public int compareTo(PathKey o) {
		int min = Math.min(theTags.size(), o.theTags.size());
		for (int i = 0; i < min; i++) {
			int comp = theTags.get(i).compareTo(o.theTags.get(i));
			if (comp != 0)
				return comp;
		}
		return Integer.compare(theTags.size(), o.theTags.size());
	}

	@Override
	public int hashCode() {
		return theHashCode;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		return obj instanceof PathKey && theHashCode == ((PathKey) obj).theHashCode && theTags.equals(((PathKey) obj).theTags);
	}

	@Override
	public String toString() {
		return String.join("/", theTags);
	}
}
