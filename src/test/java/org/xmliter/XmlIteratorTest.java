package org.xmliter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.xmliter.count.EdgeCountTable;
import org.xmliter.dict.XmlDicts;
import org.xmliter.io.GeneratedXmlInputStream;
import org.xmliter.io.XmlScanner.XmlParseException;

/** Tests the file-based entry points of {@link XmlIterator} */
public class XmlIteratorTest {
	/** Holds the test documents */
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path write(String name, String xml) throws IOException {
		Path file = folder.newFile(name).toPath();
		Files.write(file, xml.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	/**
	 * Tests event iteration over a file
	 *
	 * @throws IOException Not expected
	 * @throws XmlParseException Not expected
	 */
	@Test
	public void testIterXml() throws IOException, XmlParseException {
		Path file = write("simple.xml", "<root><item>1</item><item>2</item></root>");
		StringBuilder kinds = new StringBuilder();
		try (XmlEventIterator events = XmlIterator.iterXml(file)) {
			while (events.hasNext())
				kinds.append(events.next().getKind().charAt(0));
		}
		Assert.assertEquals("sstestee", kinds.toString());

		try (XmlEventIterator events = XmlIterator.iterXml(file, ParseLimits.of(null, 2L))) {
			Assert.assertEquals("(1, start, root)", events.next().toString());
			Assert.assertEquals("(2, start, item)", events.next().toString());
			Assert.assertFalse(events.hasNext());
		}
	}

	/**
	 * Tests conversion and counting of files
	 *
	 * @throws IOException Not expected
	 * @throws XmlParseException Not expected
	 */
	@Test
	public void testFileConsumers() throws IOException, XmlParseException {
		Path file = write("simple.xml", "<root><item>1</item><item>2</item></root>");
		Map<String, Object> dict = XmlIterator.xmlToDict(file);
		Assert.assertEquals("{\"root\":{\"item\":[\"1\",\"2\"]}}", XmlDicts.toJson(dict));
		Assert.assertEquals(Arrays.asList("1", "2"), ((Map<String, Object>) dict.get("root")).get("item"));
		Assert.assertEquals("{\"root\":null}", XmlDicts.toJson(XmlIterator.xmlToDict(file, 1, null)));
		Assert.assertNull(XmlIterator.xmlToDict(file, null, 0L));

		EdgeCountTable counts = XmlIterator.getEdgeCounts(file, null);
		Assert.assertEquals(1, counts.getCount("root"));
		Assert.assertEquals(2, counts.getCount("root", "item"));
		Assert.assertEquals(1, XmlIterator.getEdgeCounts(file, 1).getTotal());
	}

	/**
	 * Tests a large generated file
	 *
	 * @throws IOException Not expected
	 * @throws XmlParseException Not expected
	 */
	@Test
	public void testLargeFile() throws IOException, XmlParseException {
		Path file = folder.newFile("large.xml").toPath();
		Files.copy(new GeneratedXmlInputStream(20_000), file, StandardCopyOption.REPLACE_EXISTING);
		EdgeCountTable counts = XmlIterator.getEdgeCounts(file, null);
		Assert.assertEquals(20_000, counts.getCount("root", "item"));
		Assert.assertEquals(20_001, counts.getTotal());
		Assert.assertEquals(100, XmlIterator.getEdgeCounts(file, 100).getTotal());

		Map<String, Object> dict = XmlIterator.xmlToDict(file);
		List<Object> items = (List<Object>) ((Map<String, Object>) dict.get("root")).get("item");
		Assert.assertEquals(20_000, items.size());
		Map<String, Object> last = (Map<String, Object>) items.get(19_999);
		Assert.assertEquals("19999", last.get("@id"));
		Assert.assertEquals("value 19999", last.get("#text"));
	}

	/**
	 * Tests the failures of the file-based entry points
	 *
	 * @throws IOException Not expected
	 */
	@Test
	public void testFailures() throws IOException {
		Path missing = folder.getRoot().toPath().resolve("missing.xml");
		try {
			XmlIterator.iterXml(missing);
			Assert.fail("Expected NoSuchFileException");
		} catch (NoSuchFileException e) {
		}
		try {
			XmlIterator.xmlToDict(missing);
			Assert.fail("Expected NoSuchFileException");
		} catch (NoSuchFileException e) {
		} catch (XmlParseException e) {
			Assert.fail("Unexpected parse error: " + e);
		}

		Path bad = write("bad.xml", "<root>\n  <item>1</item>\n  <item>2</oops>\n</root>");
		try {
			XmlIterator.xmlToDict(bad);
			Assert.fail("Expected a parse error");
		} catch (XmlParseException e) {
			Assert.assertEquals(2, e.getLineNumber());
			Assert.assertEquals("root/item", e.getElementPath());
		}
	}
}
