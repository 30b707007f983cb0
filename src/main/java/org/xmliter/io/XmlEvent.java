package org.xmliter.io;

import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableMap;

/**
 * A single parsing notification produced by an {@link XmlScanner}: the start of an element with its attributes, the end of an element,
 * or a run of character content.
 */
public abstract class XmlEvent {
	/** The kinds of event */
	public enum Type {
		/** An element's open tag (or a self-closing tag) */
		START("start"),
		/** An element's close tag (or the implied close of a self-closing tag) */
		END("end"),
		/** A run of character data or a CDATA section */
		TEXT("text");

		/** The lower-case name of the event kind */
		public final String kind;

		private Type(String kind) {
			this.kind = kind;
		}
	}

	/** @return The kind of this event */
	public abstract Type getType();

	/** @return The tag name for {@link Type#START start} and {@link Type#END end} events, or the character content for text */
	public abstract String getValue();

	/** @return Whether this is a {@link Start} event */
	public boolean isStart() {
		return getType() == Type.START;
	}

	/** @return Whether this is an {@link End} event */
	public boolean isEnd() {
		return getType() == Type.END;
	}

	/** @return Whether this is a {@link Text} event */
	public boolean isText() {
		return getType() == Type.TEXT;
	}

	/**
	 * @param name The name of the element
	 * @param attributes The element's attributes, in source order
	 * @return The start event
	 */
	public static Start start(String name, Map<String, String> attributes) {
		return new Start(name, attributes);
	}

	/**
	 * @param name The name of the element
	 * @return The end event
	 */
	public static End end(String name) {
		return new End(name);
	}

	/**
	 * @param content The character content
	 * @return The text event
	 */
	public static Text text(String content) {
		return new Text(content);
	}

	/** The start of an element */
	public static final class Start extends XmlEvent {
		private final String theName;
		private final ImmutableMap<String, String> theAttributes;

		Start(String name, Map<String, String> attributes) {
			theName = Objects.requireNonNull(name, "name");
			theAttributes = attributes == null ? ImmutableMap.of() : ImmutableMap.copyOf(attributes);
		}

		@Override
		public Type getType() {
			return Type.START;
		}

		/** @return The name of the element */
		public String getName() {
			return theName;
		}

		/** @return The element's attributes, in source order */
		public ImmutableMap<String, String> getAttributes() {
			return theAttributes;
		}

		@Override
		public String getValue() {
			return theName;
		}

		@Override
		public int hashCode() {
			return Objects.hash(theName, theAttributes);
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Start && theName.equals(((Start) obj).theName) && theAttributes.equals(((Start) obj).theAttributes);
		}

		@Override
		public String toString() {
			StringBuilder str = new StringBuilder("<").append(theName);
			for (Map.Entry<String, String> attr : theAttributes.entrySet())
				str.append(' ').append(attr.getKey()).append("=\"").append(attr.getValue()).append('"');
			return str.append('>').toString();
		}
	}

	/** The end of an element */
	public static final class End extends XmlEvent {
		private final String theName;

		End(String name) {
			theName = Objects.requireNonNull(name, "name");
		}

		@Override
		public Type getType() {
			return Type.END;
		}

		/** @return The name of the element */
		public String getName() {
			return theName;
		}

		@Override
		public String getValue() {
			return theName;
		}

		@Override
		public int hashCode() {
			return theName.hashCode() * 31;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof End && theName.equals(((End) obj).theName);
		}

		@Override
		public String toString() {
			return "</" + theName + ">";
		}
	}

	/** A run of character content, entities decoded, whitespace preserved */
	public static final class Text extends XmlEvent {
		private final String theContent;

		Text(String content) {
			theContent = Objects.requireNonNull(content, "content");
		}

		@Override
		public Type getType() {
			return Type.TEXT;
		}

		/** @return The character content */
		public String getContent() {
			return theContent;
		}

		@Override
		public String getValue() {
			return theContent;
		}

		@Override
		public int hashCode() {
			return theContent.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Text && theContent.equals(((Text) obj).theContent);
		}

		@Override
		public String toString() {
			return theContent.replace("\n", "\\n").replace("\t", "\\t");
		}
	}
}
