package org.xmliter.io;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Determines the character set of an XML byte stream before any character is decoded. A byte-order mark wins, then the
 * <code>encoding</code> attribute of the XML declaration, then UTF-8.
 * <p>
 * The declaration is only read here to choose a decoder. It is parsed and validated again, with positions, by the {@link XmlScanner}, which
 * is where an unsupported encoding is reported.
 * </p>
 */
public class XmlEncodingSniffer {
	/** The maximum number of bytes examined for the XML declaration */
	public static final int SNIFF_LIMIT = 1024;

	private static final byte[] DECLARATION_START = "<?xml".getBytes(StandardCharsets.US_ASCII);
	private static final Pattern ENCODING_PATTERN = Pattern.compile("\\sencoding\\s*=\\s*([\"'])(.*?)\\1");

	/** The result of sniffing a stream */
	public static class Sniffed {
		private final Charset theCharset;
		private final int theBomLength;
		private final String theDeclaredEncoding;

		Sniffed(Charset charset, int bomLength, String declaredEncoding) {
			theCharset = charset;
			theBomLength = bomLength;
			theDeclaredEncoding = declaredEncoding;
		}

		/** @return The character set to decode the stream with */
		public Charset getCharset() {
			return theCharset;
		}

		/** @return The number of byte-order mark bytes that were skipped, zero if there was none */
		public int getBomLength() {
			return theBomLength;
		}

		/** @return The encoding name found in the XML declaration, or null if none was found */
		public String getDeclaredEncoding() {
			return theDeclaredEncoding;
		}
	}

	private XmlEncodingSniffer() {
	}

	/**
	 * Examines the head of the stream and leaves it positioned just after any byte-order mark
	 *
	 * @param in The stream to sniff
	 * @return The sniffing result
	 * @throws IOException If the stream cannot be read
	 */
	public static Sniffed sniff(BufferedInputStream in) throws IOException {
		in.mark(SNIFF_LIMIT);
		byte[] head = new byte[SNIFF_LIMIT];
		int len = 0;
		while (len < head.length) {
			int read = in.read(head, len, head.length - len);
			if (read < 0)
				break;
			len += read;
		}
		in.reset();

		int bom = 0;
		Charset charset = null;
		if (len >= 3 && (head[0] & 0xff) == 0xEF && (head[1] & 0xff) == 0xBB && (head[2] & 0xff) == 0xBF) {
			bom = 3;
			charset = StandardCharsets.UTF_8;
		} else if (len >= 2 && (head[0] & 0xff) == 0xFE && (head[1] & 0xff) == 0xFF) {
			bom = 2;
			charset = StandardCharsets.UTF_16BE;
		} else if (len >= 2 && (head[0] & 0xff) == 0xFF && (head[1] & 0xff) == 0xFE) {
			bom = 2;
			charset = StandardCharsets.UTF_16LE;
		}
		for (int i = 0; i < bom; i++)
			in.read();
		if (charset != null)
			return new Sniffed(charset, bom, null);

		String declared = findDeclaredEncoding(head, len);
		charset = StandardCharsets.UTF_8;
		if (declared != null) {
			Charset declaredCharset = forName(declared);
			// The declaration was readable as ASCII, so a charset that does not encode ASCII the same way cannot be right
			if (declaredCharset != null && isAsciiCompatible(declaredCharset))
				charset = declaredCharset;
		}
		return new Sniffed(charset, 0, declared);
	}

	/**
	 * @param name The name of the character set
	 * @return The character set, or null if it is unknown or the name is illegal
	 */
	public static Charset forName(String name) {
		try {
			return Charset.forName(name);
		} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
			return null;
		}
	}

	static String findDeclaredEncoding(byte[] head, int len) {
		if (len < DECLARATION_START.length || !Arrays.equals(head, 0, DECLARATION_START.length, DECLARATION_START, 0, DECLARATION_START.length))
			return null;
		int end = -1;
		for (int i = DECLARATION_START.length; i + 1 < len; i++) {
			if (head[i] == '?' && head[i + 1] == '>') {
				end = i;
				break;
			}
		}
		if (end < 0)
			return null;
		Matcher matcher = ENCODING_PATTERN.matcher(new String(head, 0, end, StandardCharsets.ISO_8859_1));
		return matcher.find() ? matcher.group(2) : null;
	}

	static boolean isAsciiCompatible(Charset charset) {
		if (!charset.canEncode())
			return false;
		return Arrays.equals(DECLARATION_START, "<?xml".getBytes(charset));
	}

	/**
	 * Convenience for callers holding a plain stream
	 *
	 * @param in The stream
	 * @return The stream if it is already buffered, or a buffered wrapper around it
	 */
	public static BufferedInputStream buffered(InputStream in) {
		return in instanceof BufferedInputStream ? (BufferedInputStream) in : new BufferedInputStream(in);
	}
}
