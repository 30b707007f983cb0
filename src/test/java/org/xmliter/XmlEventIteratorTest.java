package org.xmliter;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.Assert;
import org.junit.Test;
import org.xmliter.io.GeneratedXmlInputStream;
import org.xmliter.io.XmlScanner;
import org.xmliter.io.XmlScanner.XmlParseException;

/** Tests {@link XmlEventIterator} */
public class XmlEventIteratorTest {
	private static XmlEventIterator iterate(String xml, ParseLimits limits) {
		return XmlIterator.iterXml(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), limits);
	}

	private static List<String> records(XmlEventIterator events) throws IOException, XmlParseException {
		List<String> records = new ArrayList<>();
		while (events.hasNext())
			records.add(events.next().toString());
		return records;
	}

	private static List<String> records(String xml, ParseLimits limits) throws IOException, XmlParseException {
		return records(iterate(xml, limits));
	}

	private static List<String> list(String... items) {
		List<String> list = new ArrayList<>();
		for (String item : items)
			list.add(item);
		return list;
	}

	/**
	 * Tests that events are numbered from 1 in yield order
	 *
	 * @throws IOException Not expected
	 * @throws XmlParseException Not expected
	 */
	@Test
	public void testSequence() throws IOException, XmlParseException {
		XmlEventIterator events = iterate("<a><b>x</b><c/></a>", ParseLimits.UNBOUNDED);
		Assert.assertEquals(list("(1, start, a)", "(2, start, b)", "(3, text, x)", "(4, end, b)", "(5, start, c)", "(6, end, c)",
			"(7, end, a)"), records(events));
		Assert.assertEquals(7, events.getSequence());
		Assert.assertEquals(0, events.getDepth());
		Assert.assertFalse(events.isTruncated());
		try {
			events.next();
			Assert.fail("Expected NoSuchElementException");
		} catch (NoSuchElementException e) {
		}
	}

	/**
	 * Tests that the maximum event count ends iteration without reading further
	 *
	 * @throws IOException Not expected
	 * @throws XmlParseException Not expected
	 */
	@Test
	public void testMaxEvents() throws IOException, XmlParseException {
		// The document is malformed after the third event, which must never be read
		XmlEventIterator events = iterate("<a><b/><c></a>", ParseLimits.of(null, 3L));
		Assert.assertEquals(list("(1, start, a)", "(2, start, b)", "(3, end, b)"), records(events));
		Assert.assertTrue(events.isTruncated());
		Assert.assertEquals(1, events.getDepth());
		Assert.assertFalse(events.hasNext());

		events = iterate("<a/>", ParseLimits.of(null, 0L));
		Assert.assertEquals(list(), records(events));
		Assert.assertTrue(events.isTruncated());
		events = iterate("<a/>", ParseLimits.of(null, 1L));
		Assert.assertEquals(list("(1, start, a)"), records(events));
		Assert.assertTrue(events.isTruncated());
		// A document that ends exactly at the limit is complete
		events = iterate("<a><b/></a><!-- trailing -->", ParseLimits.of(null, 4L));
		Assert.assertEquals(list("(1, start, a)", "(2, start, b)", "(3, end, b)", "(4, end, a)"), records(events));
		Assert.assertFalse(events.isTruncated());
		Assert.assertEquals(list("(1, start, a)", "(2, end, a)"), records("<a/>", ParseLimits.of(null, 100L)));
	}

	/**
	 * Tests depth truncation at each depth of a small document
	 *
	 * @throws IOException Not expected
	 * @throws XmlParseException Not expected
	 */
	@Test
	public void testMaxDepth() throws IOException, XmlParseException {
		String xml = "<a x=\"1\">t<b><c>deep</c></b>u<d/></a>";
		Assert.assertEquals(list(), records(xml, ParseLimits.of(0, null)));
		XmlEventIterator events = iterate(xml, ParseLimits.of(1, null));
		Assert.assertEquals(list("(1, start, a)", "(2, text, t)", "(3, text, u)", "(4, end, a)"), records(events));
		Assert.assertTrue(events.isTruncated());
		Assert.assertEquals(list("(1, start, a)", "(2, text, t)", "(3, start, b)", "(4, end, b)", "(5, text, u)", "(6, start, d)",
			"(7, end, d)", "(8, end, a)"), records(xml, ParseLimits.of(2, null)));
		events = iterate(xml, ParseLimits.of(3, null));
		Assert.assertEquals(11, records(events).size());
		Assert.assertFalse(events.isTruncated());
	}

	/**
	 * Tests both limits together
	 *
	 * @throws IOException Not expected
	 * @throws XmlParseException Not expected
	 */
	@Test
	public void testCombinedLimits() throws IOException, XmlParseException {
		String xml = "<a>t<b><c>deep</c></b>u<d/></a>";
		Assert.assertEquals(list("(1, start, a)", "(2, text, t)", "(3, text, u)"), records(xml, ParseLimits.of(1, 3L)));
		Assert.assertEquals(list("(1, start, a)", "(2, text, t)", "(3, start, b)", "(4, end, b)"), records(xml, ParseLimits.of(2, 4L)));
	}

	/**
	 * Tests that parse errors pass through, even from inside a suppressed subtree
	 *
	 * @throws IOException Not expected
	 */
	@Test
	public void testErrors() throws IOException {
		XmlEventIterator events = iterate("<a><b><c></b></a>", ParseLimits.of(1, null));
		List<String> seen = new ArrayList<>();
		try {
			while (events.hasNext())
				seen.add(events.next().toString());
			Assert.fail("Expected a parse error");
		} catch (XmlParseException e) {
			Assert.assertEquals("a/b/c", e.getElementPath());
		}
		Assert.assertEquals(list("(1, start, a)"), seen);
	}

	/**
	 * Breaks early out of a 1000-item document
	 *
	 * @throws IOException Not expected
	 * @throws XmlParseException Not expected
	 */
	@Test
	public void testEarlyBreak() throws IOException, XmlParseException {
		GeneratedXmlInputStream in = new GeneratedXmlInputStream(1000);
		long count = 0;
		long lastSequence = 0;
		try (XmlEventIterator events = XmlIterator.iterXml(in, ParseLimits.UNBOUNDED)) {
			while (events.hasNext()) {
				EventRecord record = events.next();
				Assert.assertEquals(lastSequence + 1, record.getSequence());
				lastSequence = record.getSequence();
				if (++count == 101)
					break;
			}
		}
		Assert.assertEquals(101, count);
		Assert.assertTrue(in.isClosed());
	}

	/**
	 * Pulls a small prefix from an enormous generated document. The work done must depend only on the prefix.
	 *
	 * @throws IOException Not expected
	 * @throws XmlParseException Not expected
	 */
	@Test(timeout = 10_000)
	public void testPrefixCost() throws IOException, XmlParseException {
		for (long items : new long[] { 1_000L, 1_000_000L, Long.MAX_VALUE }) {
			GeneratedXmlInputStream in = new GeneratedXmlInputStream(items);
			try (XmlEventIterator events = XmlIterator.iterXml(in, ParseLimits.of(null, 1000L))) {
				Assert.assertEquals(1000, records(events).size());
			}
			// 1000 events take about 10KB of this document. The rest is decoder and buffer read-ahead.
			Assert.assertTrue("Read " + in.getPosition() + " bytes", in.getPosition() < 64 * 1024);
		}
	}

	/**
	 * Checks, over random documents and depth limits, that the yielded events are balanced and never deeper than the limit
	 *
	 * @throws IOException Not expected
	 * @throws XmlParseException Not expected
	 */
	@Test
	public void testRandomBalance() throws IOException, XmlParseException {
		Random random = new Random(20_250_101L);
		RandomXml generator = new RandomXml(random, 7, 4);
		for (int doc = 0; doc < 200; doc++) {
			String xml = generator.generate();
			Integer maxDepth = random.nextInt(4) == 0 ? null : random.nextInt(8);
			XmlEventIterator events = iterate(xml, ParseLimits.of(maxDepth, null));
			Deque<String> open = new ArrayDeque<>();
			int starts = 0;
			long sequence = 0;
			while (events.hasNext()) {
				EventRecord record = events.next();
				Assert.assertEquals(++sequence, record.getSequence());
				switch (record.getEvent().getType()) {
				case START:
					open.push(record.getValue());
					starts++;
					if (maxDepth != null)
						Assert.assertTrue(xml, open.size() <= maxDepth);
					break;
				case END:
					Assert.assertEquals(xml, open.pop(), record.getValue());
					break;
				case TEXT:
					Assert.assertFalse(xml, open.isEmpty());
					break;
				}
				Assert.assertEquals(open.size(), events.getDepth());
			}
			Assert.assertTrue(xml, open.isEmpty());
			if (maxDepth == null)
				Assert.assertEquals(xml, generator.getElementCount(), starts);
		}
	}

	/**
	 * Tests the java.util adapters
	 *
	 * @throws IOException Not expected
	 */
	@Test
	public void testAdapters() throws IOException {
		Iterator<EventRecord> iter = iterate("<a><b/></a>", ParseLimits.UNBOUNDED).asIterator();
		int count = 0;
		while (iter.hasNext()) {
			iter.next();
			count++;
		}
		Assert.assertEquals(4, count);

		GeneratedXmlInputStream in = new GeneratedXmlInputStream(10);
		try (Stream<EventRecord> stream = XmlIterator.iterXml(in, ParseLimits.of(1, null)).stream()) {
			Assert.assertEquals(list("start", "text", "end"),
				stream.map(EventRecord::getKind).distinct().collect(Collectors.toList()));
		}
		Assert.assertTrue(in.isClosed());

		try (Stream<EventRecord> stream = iterate("<a><b></a>", ParseLimits.UNBOUNDED).stream()) {
			stream.count();
			Assert.fail("Expected an UncheckedXmlException");
		} catch (UncheckedXmlException e) {
			Assert.assertNotNull(e.getParseException());
			Assert.assertNull(e.getIOException());
			try {
				throw e.rethrow();
			} catch (XmlParseException ex) {
				Assert.assertSame(e.getParseException(), ex);
			}
		}

		InputStream failing = new InputStream() {
			@Override
			public int read() throws IOException {
				throw new IOException("Disk on fire");
			}
		};
		try {
			new XmlEventIterator(new XmlScanner(failing), null).asIterator().hasNext();
			Assert.fail("Expected an UncheckedXmlException");
		} catch (UncheckedXmlException e) {
			Assert.assertEquals("Disk on fire", e.getIOException().getMessage());
			try {
				throw e.rethrow();
			} catch (IOException ex) {
				Assert.assertSame(e.getIOException(), ex);
			} catch (XmlParseException ex) {
				Assert.fail("Expected the I/O failure, not " + ex);
			}
		}
	}
}
