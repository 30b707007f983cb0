package org.xmliter;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.apache.log4j.Logger;
import org.xmliter.count.EdgeCountTable;
import org.xmliter.count.EdgeCounter;
import org.xmliter.dict.XmlDictReducer;
import org.xmliter.io.XmlScanner;
import org.xmliter.io.XmlScanner.XmlParseException;

/**
 * Entry points for streaming XML: lazy event iteration, path counting and conversion to nested maps. Every call reads its own source;
 * nothing is shared between calls.
 */
public class XmlIterator {
	static Logger log = Logger.getLogger(XmlIterator.class);

	private XmlIterator() {
	}

	/**
	 * @param file The XML file to read
	 * @return An iterator over all of the file's events. The caller must close it.
	 * @throws IOException If the file cannot be opened
	 */
	public static XmlEventIterator iterXml(Path file) throws IOException {
		return iterXml(file, ParseLimits.UNBOUNDED);
	}

	/**
	 * @param file The XML file to read
	 * @param limits The limits to apply to the events
	 * @return An iterator over the file's events. The caller must close it.
	 * @throws IOException If the file cannot be opened
	 */
	public static XmlEventIterator iterXml(Path file, ParseLimits limits) throws IOException {
		if (log.isDebugEnabled())
			log.debug("Reading XML from " + file);
		return iterXml(Files.newInputStream(file), limits);
	}

	/**
	 * @param in The XML bytes. The encoding is detected from a byte-order mark or the XML declaration, defaulting to UTF-8.
	 * @param limits The limits to apply to the events
	 * @return An iterator over the stream's events. Closing it closes the stream.
	 */
	public static XmlEventIterator iterXml(InputStream in, ParseLimits limits) {
		return new XmlEventIterator(new XmlScanner(in), limits);
	}

	/**
	 * @param in The XML characters
	 * @param limits The limits to apply to the events
	 * @return An iterator over the reader's events. Closing it closes the reader.
	 */
	public static XmlEventIterator iterXml(Reader in, ParseLimits limits) {
		return new XmlEventIterator(new XmlScanner(in), limits);
	}

	/**
	 * @param file The XML file to read
	 * @param nMax The maximum number of elements to count, or null to count the whole file
	 * @return The number of elements at each root-to-element tag path
	 * @throws IOException If the file cannot be read
	 * @throws XmlParseException If the XML is malformed
	 */
	public static EdgeCountTable getEdgeCounts(Path file, Integer nMax) throws IOException, XmlParseException {
		try (XmlEventIterator events = iterXml(file, ParseLimits.UNBOUNDED)) {
			return EdgeCounter.count(events, nMax);
		}
	}

	/**
	 * @param in The XML bytes. The stream is not closed.
	 * @param nMax The maximum number of elements to count, or null to count the whole document
	 * @return The number of elements at each root-to-element tag path
	 * @throws IOException If the stream cannot be read
	 * @throws XmlParseException If the XML is malformed
	 */
	public static EdgeCountTable getEdgeCounts(InputStream in, Integer nMax) throws IOException, XmlParseException {
		return EdgeCounter.count(iterXml(in, ParseLimits.UNBOUNDED), nMax);
	}

	/**
	 * @param file The XML file to read
	 * @return The whole document as nested maps
	 * @throws IOException If the file cannot be read
	 * @throws XmlParseException If the XML is malformed
	 * @see XmlDictReducer
	 */
	public static Map<String, Object> xmlToDict(Path file) throws IOException, XmlParseException {
		return xmlToDict(file, null, null);
	}

	/**
	 * @param file The XML file to read
	 * @param maxDepth The deepest element level to include (the root is level 1), or null for no limit
	 * @param maxEvents The maximum number of events to include, or null for no limit
	 * @return The document as nested maps, or null if the limits excluded everything
	 * @throws IOException If the file cannot be read
	 * @throws XmlParseException If the XML is malformed
	 * @see XmlDictReducer
	 */
	public static Map<String, Object> xmlToDict(Path file, Integer maxDepth, Long maxEvents) throws IOException, XmlParseException {
		try (XmlEventIterator events = iterXml(file, ParseLimits.of(maxDepth, maxEvents))) {
			return new XmlDictReducer().reduce(events);
		}
	}

	/**
	 * @param in The XML bytes. The stream is not closed.
	 * @param limits The limits to apply
	 * @return The document as nested maps, or null if the limits excluded everything
	 * @throws IOException If the stream cannot be read
	 * @throws XmlParseException If the XML is malformed
	 */
	public static Map<String, Object> xmlToDict(InputStream in, ParseLimits limits) throws IOException, XmlParseException {
		return new XmlDictReducer().reduce(iterXml(in, limits));
	}

	/**
	 * @param in The XML characters. The reader is not closed.
	 * @param limits The limits to apply
	 * @return The document as nested maps, or null if the limits excluded everything
	 * @throws IOException If the reader cannot be read
	 * @throws XmlParseException If the XML is malformed
	 */
	public static Map<String, Object> xmlToDict(Reader in, ParseLimits limits) throws IOException, XmlParseException {
		return new XmlDictReducer().reduce(iterXml(in, limits));
	}
}
