package org.xmliter;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.apache.log4j.Logger;
import org.xmliter.io.XmlEvent;
import org.xmliter.io.XmlScanner;
import org.xmliter.io.XmlScanner.XmlParseException;

/**
 * <p>
 * Pulls events from an {@link XmlScanner}, numbering them and applying {@link ParseLimits}.
 * </p>
 * <p>
 * With a maximum depth D (the root element is at depth 1), an element at depth D or shallower is yielded with its attributes, text and
 * end. An element at depth D+1 is suppressed with its whole subtree, including its end, though the scanner still reads through it. The
 * yielded events are therefore always balanced, unless the maximum event count stops iteration first. Sequence numbers count yielded
 * events only.
 * </p>
 * <p>
 * When the maximum event count is reached, iteration ends as if the document had, and the scanner is not pulled again. Errors from the
 * scanner are thrown unchanged.
 * </p>
 */
public class XmlEventIterator implements Closeable {
	static Logger log = Logger.getLogger(XmlEventIterator.class);

	private final XmlScanner theScanner;
	private final ParseLimits theLimits;
	private final Deque<String> theOpenTags;
	private int theSuppressedDepth;
	private long theSequence;
	private EventRecord theNext;
	private boolean isEnded;
	private boolean isTruncated;

	/**
	 * @param scanner The scanner to pull events from
	 * @param limits The limits to apply
	 */
	public XmlEventIterator(XmlScanner scanner, ParseLimits limits) {
		if (scanner == null)
			throw new NullPointerException("Scanner cannot be null");
		theScanner = scanner;
		theLimits = limits == null ? ParseLimits.UNBOUNDED : limits;
		theOpenTags = new ArrayDeque<>();
	}

	/** @return The scanner this iterator pulls from */
	public XmlScanner getScanner() {
		return theScanner;
	}

	/** @return The limits this iterator applies */
	public ParseLimits getLimits() {
		return theLimits;
	}

	/** @return The number of yielded elements that are still open */
	public int getDepth() {
		return theOpenTags.size();
	}

	/** @return The sequence number of the last event yielded, 0 if none has been */
	public long getSequence() {
		return theSequence;
	}

	/**
	 * @return Whether either limit has suppressed or cut off any event so far. A document whose root element ends exactly at the maximum
	 *         event count is not truncated.
	 */
	public boolean isTruncated() {
		return isTruncated;
	}

	/**
	 * @return Whether another event will be yielded
	 * @throws IOException If the source cannot be read
	 * @throws XmlParseException If the XML is malformed
	 */
	public boolean hasNext() throws IOException, XmlParseException {
		if (theNext == null && !isEnded)
			theNext = pull();
		return theNext != null;
	}

	/**
	 * @return The next event
	 * @throws IOException If the source cannot be read
	 * @throws XmlParseException If the XML is malformed
	 * @throws NoSuchElementException If iteration has ended
	 */
	public EventRecord next() throws IOException, XmlParseException, NoSuchElementException {
		if (!hasNext())
			throw new NoSuchElementException("No more XML events");
		EventRecord next = theNext;
		theNext = null;
		return next;
	}

	private EventRecord pull() throws IOException, XmlParseException {
		Long maxEvents = theLimits.getMaxEvents();
		if (maxEvents != null && theSequence >= maxEvents) {
			isEnded = true;
			// Once the root has ended, only comments and processing instructions can follow
			if (theSequence == 0 || theScanner.getDepth() > 0)
				truncated("maxEvents=" + maxEvents);
			return null;
		}
		Integer maxDepth = theLimits.getMaxDepth();
		while (true) {
			XmlEvent event = theScanner.next();
			if (event == null) {
				isEnded = true;
				return null;
			}
			if (theSuppressedDepth > 0) {
				if (event.isStart())
					theSuppressedDepth++;
				else if (event.isEnd())
					theSuppressedDepth--;
				continue;
			}
			switch (event.getType()) {
			case START:
				if (maxDepth != null && theOpenTags.size() >= maxDepth) {
					theSuppressedDepth = 1;
					truncated("maxDepth=" + maxDepth);
					continue;
				}
				theOpenTags.push(event.getValue());
				break;
			case END:
				theOpenTags.pop();
				break;
			case TEXT:
				break;
			}
			return new EventRecord(++theSequence, event);
		}
	}

	private void truncated(String limit) {
		if (isTruncated)
			return;
		isTruncated = true;
		if (log.isDebugEnabled())
			log.debug("Truncating XML events by " + limit + " after event " + theSequence);
	}

	/**
	 * @return A java.util iterator over the remaining events of this iterator. Checked failures are thrown wrapped in an
	 *         {@link UncheckedXmlException}.
	 */
	public Iterator<EventRecord> asIterator() {
		return new Iterator<EventRecord>() {
			@Override
			public boolean hasNext() {
				try {
					return XmlEventIterator.this.hasNext();
				} catch (IOException e) {
					throw new UncheckedXmlException(e);
				} catch (XmlParseException e) {
					throw new UncheckedXmlException(e);
				}
			}

			@Override
			public EventRecord next() {
				try {
					return XmlEventIterator.this.next();
				} catch (IOException e) {
					throw new UncheckedXmlException(e);
				} catch (XmlParseException e) {
					throw new UncheckedXmlException(e);
				}
			}
		};
	}

	/**
	 * @return A sequential stream of the remaining events of this iterator. Closing the stream closes this iterator's source. Checked
	 *         failures are thrown wrapped in an {@link UncheckedXmlException}.
	 */
	public Stream<EventRecord> stream() {
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(asIterator(), Spliterator.ORDERED | Spliterator.NONNULL), false)
			.onClose(() -> {
				try {
					close();
				} catch (IOException e) {
					throw new UncheckedIOException(e);
				}
			});
	}

	@Override
	public void close() throws IOException {
		isEnded = true;
		theNext = null;
		theScanner.close();
	}

	@Override
	public String toString() {
		return "XML events (" + theLimits + ") at " + theSequence;
	}
}
