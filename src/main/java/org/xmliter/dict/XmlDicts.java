package org.xmliter.dict;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.json.simple.JSONValue;

/** Utilities for the nested maps produced by {@link XmlDictReducer} */
public class XmlDicts {
	/** Stands in for null on the traversal stack, which does not accept nulls */

	private XmlDicts() {
	}

	/**
	 * @param dict The reduced XML: a map, list, string or null
	 * @return Compact JSON for the value, with map entries in their iteration order
	 */
	public static String toJson(Object dict) {
		return JSONValue.toJSONString(dict);
	}

	/**
	 * @param dict The reduced XML: a map, list, string or null
	 * @param out The writer to write compact JSON to
	 * @throws IOException If the writer throws it
	 */
	public static void writeJson(Object dict, Writer out) throws IOException {
		JSONValue.writeJSONString(dict, out);
	}

	/**
	 * Writes reduced XML as tab-indented JSON, one entry per line
	 *
	 * @param dict The reduced XML
	 * @return The formatted JSON
	 */
	public static String format(Object dict) {
		StringBuilder ret = new StringBuilder();
		format(dict, ret, 0);
		return ret.toString();
	}

	private static void format(Object json, StringBuilder ret, int indent) {
		if (json instanceof Map)
			formatObject((Map<String, Object>) json, ret, indent);
		else if (json instanceof List)
			formatArray((List<Object>) json, ret, indent);
		else if (json instanceof String)
			ret.append('"').append(JSONValue.escape((String) json)).append('"');
		else
			ret.append(json);
	}

	private static void formatObject(Map<String, Object> json, StringBuilder ret, int indent) {
		ret.append('{');
		indent++;
		Iterator<Map.Entry<String, Object>> iter = json.entrySet().iterator();
		while (iter.hasNext()) {
			Map.Entry<String, Object> entry = iter.next();
			ret.append('\n');
			indent(ret, indent);
			ret.append('"').append(JSONValue.escape(entry.getKey())).append("\": ");
			format(entry.getValue(), ret, indent);
			if (iter.hasNext())
				ret.append(',');
		}
		if (!json.isEmpty()) {
			ret.append('\n');
			indent(ret, indent - 1);
		}
		ret.append('}');
	}

	private static void formatArray(List<Object> json, StringBuilder ret, int indent) {
		ret.append('[');
		indent++;
		Iterator<Object> iter = json.iterator();
		while (iter.hasNext()) {
			ret.append('\n');
			indent(ret, indent);
			format(iter.next(), ret, indent);
			if (iter.hasNext())
				ret.append(',');
		}
		if (!json.isEmpty()) {
			ret.append('\n');
			indent(ret, indent - 1);
		}
		ret.append(']');
	}

	private static void indent(StringBuilder ret, int indent) {
		for (int i = 0; i < indent; i++)
			ret.append('\t');
	}

	/**
	 * Counts the string values in reduced XML: attribute values and text values. Empty elements are null and do not count.
	 *
	 * @param dict The reduced XML
	 * @return The number of string leaves in the tree, 0 for a null tree
	 */
	public static long countLeaves(Object dict) {
		if (dict == null)
			return 0;
		long leaves = 0;
		Deque<Object> stack = new ArrayDeque<>();
		stack.push(dict);
		while (!stack.isEmpty()) {
			Object value = stack.pop();
			if (value instanceof Map) {
				for (Object child : ((Map<?, ?>) value).values()) {
					if (child != null)
						stack.push(child);
				}
			} else if (value instanceof List) {
				for (Object child : (List<?>) value) {
					if (child != null)
						stack.push(child);
				}
			} else
				leaves++;
		}
		return leaves;
	}
}
