package org.xmliter.dict;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.xmliter.EventRecord;
import org.xmliter.XmlEventIterator;
import org.xmliter.io.XmlEvent;
import org.xmliter.io.XmlScanner.XmlParseException;

/**
 * <p>
 * Folds an XML event stream into nested maps in the xmltodict convention:
 * <ul>
 * <li>An element with no attributes, children or text is null.</li>
 * <li>An element with only text is the text, stripped of leading and trailing whitespace.</li>
 * <li>Otherwise an element is a {@link LinkedHashMap} of its attributes (each key prefixed with {@link #getAttributePrefix() '@'}), then
 * its children by tag name in first-seen order, then its stripped text under {@link #getTextKey() '#text'} if that is not empty.</li>
 * <li>The first child with a given tag is stored as its value. A second one replaces it with an {@link ArrayList} of both, and later ones
 * are appended.</li>
 * </ul>
 * The result is a single-entry map from the root's tag to its value.
 * </p>
 * <p>
 * The reducer keeps one frame per open element, so memory is bounded by nesting depth plus the size of the result.
 * </p>
 */
public class XmlDictReducer {
	static Logger log = Logger.getLogger(XmlDictReducer.class);

	/** The default prefix for attribute keys */
	public static final String DEFAULT_ATTRIBUTE_PREFIX = "@";
	/** The default key for an element's text when it also has attributes or children */
	public static final String DEFAULT_TEXT_KEY = "#text";

	private String theAttributePrefix = DEFAULT_ATTRIBUTE_PREFIX;
	private String theTextKey = DEFAULT_TEXT_KEY;

	/** @return The prefix for attribute keys */
	public String getAttributePrefix() {
		return theAttributePrefix;
	}

	/**
	 * @param prefix The prefix for attribute keys
	 * @return This reducer
	 */
	public XmlDictReducer setAttributePrefix(String prefix) {
		if (prefix == null)
			throw new NullPointerException("Attribute prefix cannot be null");
		theAttributePrefix = prefix;
		return this;
	}

	/** @return The key for an element's text when it also has attributes or children */
	public String getTextKey() {
		return theTextKey;
	}

	/**
	 * @param textKey The key for an element's text when it also has attributes or children
	 * @return This reducer
	 */
	public XmlDictReducer setTextKey(String textKey) {
		if (textKey == null || textKey.isEmpty())
			throw new IllegalArgumentException("Text key cannot be empty");
		theTextKey = textKey;
		return this;
	}

	/**
	 * Consumes the events and folds them into a map. If the iterator stops while elements are still open (because of its maximum event
	 * count), the open elements are closed innermost-first as though their ends had been read.
	 *
	 * @param events The events to reduce
	 * @return The single-entry map of the root element's tag to its value, or null if no event was yielded
	 * @throws IOException If the source cannot be read
	 * @throws XmlParseException If the XML is malformed. Nothing is returned in this case.
	 */
	public Map<String, Object> reduce(XmlEventIterator events) throws IOException, XmlParseException {
		Deque<ElementFrame> stack = new ArrayDeque<>();
		Map<String, Object> result = null;
		long elements = 0;
		while (events.hasNext()) {
			EventRecord record = events.next();
			XmlEvent event = record.getEvent();
			switch (event.getType()) {
			case START:
				stack.push(new ElementFrame((XmlEvent.Start) event));
				elements++;
				break;
			case TEXT:
				if (!stack.isEmpty())
					stack.peek().theText.append(event.getValue());
				break;
			case END:
				result = pop(stack);
				break;
			}
		}
		if (!stack.isEmpty()) {
			if (log.isDebugEnabled())
				log.debug("Closing " + stack.size() + " elements left open after event " + events.getSequence());
			while (!stack.isEmpty())
				result = pop(stack);
		}
		if (log.isDebugEnabled())
			log.debug("Reduced " + elements + " elements" + (events.isTruncated() ? " (truncated)" : ""));
		return result;
	}

	/** Pops the top frame, merging its value into its parent. Returns the root entry if the frame was the root. */
	private Map<String, Object> pop(Deque<ElementFrame> stack) {
		ElementFrame frame = stack.pop();
		Object value = frame.toValue();
		if (stack.isEmpty()) {
			Map<String, Object> root = new LinkedHashMap<>();
			root.put(frame.theTag, value);
			return root;
		}
		stack.peek().addChild(frame.theTag, value);
		return null;
	}

	/**
	 * Strips leading and trailing whitespace, including Unicode spaces such as the no-break space
	 *
	 * @param text The text to strip
	 * @return The stripped text
	 */
	public static String strip(CharSequence text) {
		int start = 0;
		int end = text.length();
		while (start < end && isWhitespace(text.charAt(start)))
			start++;
		while (end > start && isWhitespace(text.charAt(end - 1)))
			end--;
		return text.subSequence(start, end).toString();
	}

	static boolean isWhitespace(char ch) {
		return Character.isWhitespace(ch) || Character.isSpaceChar(ch) || ch == '\u0085';
	}

	private class ElementFrame {
		final String theTag;
		final Map<String, String> theAttributes;
		final StringBuilder theText;
		Map<String, Object> theChildren;

		ElementFrame(XmlEvent.Start start) {
			theTag = start.getName();
			theAttributes = start.getAttributes();
			theText = new StringBuilder();
		}

		void addChild(String tag, Object value) {
			if (theChildren == null)
				theChildren = new LinkedHashMap<>();
			Object existing = theChildren.get(tag);
			if (existing == null && !theChildren.containsKey(tag))
				theChildren.put(tag, value);
			else if (existing instanceof List) // Element values are never lists themselves
				((List<Object>) existing).add(value);
			else {
				List<Object> list = new ArrayList<>();
				list.add(existing);
				list.add(value);
				theChildren.put(tag, list);
			}
		}

		Object toValue() {
			String text = strip(theText);
			if (theAttributes.isEmpty() && theChildren == null)
				return text.isEmpty() ? null : text;
			Map<String, Object> value = new LinkedHashMap<>();
			for (Map.Entry<String, String> attr : theAttributes.entrySet())
				value.put(theAttributePrefix + attr.getKey(), attr.getValue());
			if (theChildren != null)
				value.putAll(theChildren);
			if (!text.isEmpty())
				value.put(theTextKey, text);
			return value;
		}
	}
}
