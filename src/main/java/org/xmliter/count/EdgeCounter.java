package org.xmliter.count;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;

import org.apache.log4j.Logger;
import org.xmliter.XmlEventIterator;
import org.xmliter.io.XmlEvent;
import org.xmliter.io.XmlScanner.XmlParseException;

/** Tallies how many elements occur at each root-to-element tag path of a document */
public class EdgeCounter {
	static Logger log = Logger.getLogger(EdgeCounter.class);

	private EdgeCounter() {
	}

	/**
	 * Counts the paths of every element the events describe
	 *
	 * @param events The events to count
	 * @return The counts
	 * @throws IOException If the source cannot be read
	 * @throws XmlParseException If the XML is malformed
	 */
	public static EdgeCountTable count(XmlEventIterator events) throws IOException, XmlParseException {
		return count(events, null);
	}

	/**
	 * Counts the paths of elements the events describe, stopping once <code>nMax</code> elements have been counted. No further input is
	 * read after that.
	 *
	 * @param events The events to count
	 * @param nMax The maximum number of elements to count, or null to count them all
	 * @return The counts
	 * @throws IOException If the source cannot be read
	 * @throws XmlParseException If the XML is malformed
	 */
	public static EdgeCountTable count(XmlEventIterator events, Integer nMax) throws IOException, XmlParseException {
		if (nMax != null && nMax < 0)
			throw new IllegalArgumentException("Maximum element count must not be negative: " + nMax);
		EdgeCountTable table = new EdgeCountTable();
		Deque<PathKey> path = new ArrayDeque<>();
		long starts = 0;
		while ((nMax == null || starts < nMax) && events.hasNext()) {
			XmlEvent event = events.next().getEvent();
			switch (event.getType()) {
			case START:
				PathKey key = path.isEmpty() ? PathKey.of(event.getValue()) : path.peek().child(event.getValue());
				table.increment(key);
				path.push(key);
				starts++;
				break;
			case END:
				path.pop();
				break;
			case TEXT:
				break;
			}
		}
		if (log.isDebugEnabled())
			log.debug("Counted " + table.getTotal() + " elements over " + table.size() + " paths"
				+ (nMax != null && starts >= nMax ? " (stopped at " + nMax + ")" : ""));
		return table;
	}
}
