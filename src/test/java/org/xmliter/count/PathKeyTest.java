package org.xmliter.count;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

/** Tests {@link PathKey} */
public class PathKeyTest {
	/** Tests building and taking apart paths */
	@Test
	public void testStructure() {
		PathKey book = PathKey.parse("catalog/book");
		PathKey title = book.child("title");
		Assert.assertEquals(PathKey.of("catalog", "book", "title"), title);
		Assert.assertEquals(PathKey.of(Arrays.asList("catalog", "book", "title")).hashCode(), title.hashCode());
		Assert.assertEquals("catalog/book/title", title.toString());
		Assert.assertEquals(3, title.getDepth());
		Assert.assertEquals("title", title.getLeaf());
		Assert.assertEquals("catalog", title.getRoot());
		Assert.assertEquals(book, title.getParent());
		Assert.assertNull(PathKey.of("catalog").getParent());
		Assert.assertTrue(title.startsWith(book));
		Assert.assertTrue(title.startsWith(title));
		Assert.assertFalse(book.startsWith(title));
		Assert.assertFalse(title.startsWith(PathKey.of("catalog", "magazine")));
		Assert.assertNotEquals(PathKey.of("a", "b"), PathKey.of("b", "a"));
		try {
			PathKey.of();
			Assert.fail("Expected IllegalArgumentException");
		} catch (IllegalArgumentException e) {
		}
	}

	/** Tests ordering */
	@Test
	public void testCompare() {
		Assert.assertTrue(PathKey.of("a").compareTo(PathKey.of("a", "b")) < 0);
		Assert.assertTrue(PathKey.of("a", "c").compareTo(PathKey.of("a", "b")) > 0);
		Assert.assertEquals(0, PathKey.parse("a/b").compareTo(PathKey.of("a", "b")));
	}
}
