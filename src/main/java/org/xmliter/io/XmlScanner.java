package org.xmliter.io;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnmappableCharacterException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableMap;

/**
 * <p>
 * A pull tokenizer for XML. Each call to {@link #next()} returns the next {@link XmlEvent} in document order, reading only as much of the
 * source as is needed to produce it.
 * </p>
 * <p>
 * Every error is reported with an exact {@link FilePosition}: character offset, byte offset, line and column.
 * </p>
 * <p>
 * <b>This class is NOT a full-featured XML parser.</b> Several features of XML are not supported or treated differently:
 * <ul>
 * <li>Namespaces are not handled specially, but rather are treated as part of the element/attribute name.</li>
 * <li>Only the five standard named entities are recognized. A DOCTYPE declaration is skipped without resolving anything it refers to,
 * and one with an internal subset is rejected.</li>
 * <li>Comments and processing instructions are validated and skipped.</li>
 * </ul>
 * As a bonus, it is not subject to the vulnerabilities of parsers that pull in external content as directed by the XML data.
 * </p>
 */
public class XmlScanner implements Closeable {
	static Logger log = Logger.getLogger(XmlScanner.class);

	/** The name of the version attribute for the XML declaration */
	public static final String VERSION = "version";
	/** The name of the encoding attribute for the XML declaration */
	public static final String ENCODING = "encoding";
	/** The name of the standalone attribute for the XML declaration */
	public static final String STANDALONE = "standalone";
	/** Standard named entities in XML by their name (e.g. "amp" for "&amp;amp;") */
	public static final Map<String, String> STANDARD_NAMED_ENTITIES = ImmutableMap.<String, String> builder()//
		.put("quot", "\"")//
		.put("amp", "&")//
		.put("apos", "'")//
		.put("gt", ">")//
		.put("lt", "<")//
		.build();

	private static final int EOF = -1;
	private static final int DECODE_ERROR = -2;
	private static final String CDATA_KEYWORD = "CDATA[";
	private static final String DOCTYPE_KEYWORD = "OCTYPE";

	/** Thrown from {@link XmlScanner#next()} when the XML is malformed */
	public static class XmlParseException extends TextParseException {
		private final String theElementPath;

		/**
		 * @param elementPath The '/'-separated names of the elements open when the error occurred, empty before the root element
		 * @param message The message indicating the nature of the XML malformation
		 * @param position The position in the source where the error was detected
		 */
		public XmlParseException(String elementPath, String message, FilePosition position) {
			super(message, position);
			theElementPath = elementPath;
		}

		/** @return The '/'-separated names of the elements open when the error occurred, empty before the root element */
		public String getElementPath() {
			return theElementPath;
		}
	}

	/** Thrown from {@link XmlScanner#next()} when the XML declaration names an encoding that cannot be decoded */
	public static class UnsupportedXmlEncodingException extends XmlParseException {
		private final String theDeclaredEncoding;

		/**
		 * @param message The message describing the problem
		 * @param position The position of the encoding value in the declaration
		 * @param declaredEncoding The encoding name as declared
		 */
		public UnsupportedXmlEncodingException(String message, FilePosition position, String declaredEncoding) {
			super("", message, position);
			theDeclaredEncoding = declaredEncoding;
		}

		/** @return The encoding name as declared in the document */
		public String getDeclaredEncoding() {
			return theDeclaredEncoding;
		}
	}

	private enum State {
		INITIAL, PROLOG, CONTENT, EPILOG, DONE
	}

	private final InputStream theStream;
	private Reader theReader;
	private Charset theCharset;
	private ByteCounter theByteCounter;
	private int theTabLength = 1;

	private final char[] theBuffer = new char[8192];
	private int theBufferPos;
	private int theBufferLen;
	private int thePushback = EOF;
	private CharacterCodingException theDecodeError;

	private int theChar;
	private int theCharSourceLength;
	private int theCharBytes;
	private long thePosition;
	private long theByteOffset;
	private long theLineNumber;
	private long theCharNumber;
	private long theMarkPosition;
	private long theMarkByteOffset;
	private long theMarkLineNumber;
	private long theMarkCharNumber;

	private State theState = State.INITIAL;
	private final Deque<String> theOpenElements = new ArrayDeque<>();
	private String thePendingEnd;
	private boolean hasDoctype;
	private String theVersion;
	private String theDeclaredEncoding;
	private Boolean isStandalone;
	private XmlParseException theParseFailure;
	private IOException theIOFailure;

	private final StringBuilder theText = new StringBuilder();
	private final StringBuilder theNameBuffer = new StringBuilder();

	/**
	 * Creates a scanner for a binary stream. The character encoding is taken from a byte-order mark or the XML declaration, or is
	 * defaulted to UTF-8. Nothing is read until the first call to {@link #next()}.
	 *
	 * @param in The stream to read XML from
	 */
	public XmlScanner(InputStream in) {
		if (in == null)
			throw new NullPointerException("Stream cannot be null");
		theStream = in;
	}

	/**
	 * Creates a scanner for a character stream. An encoding specified by the XML declaration is validated but otherwise ignored. Byte
	 * offsets are reported as -1.
	 *
	 * @param in The reader to read XML from
	 */
	public XmlScanner(Reader in) {
		if (in == null)
			throw new NullPointerException("Reader cannot be null");
		theStream = null;
		theReader = in;
		theByteOffset = -1;
	}

	/** @return The number of columns a tab advances the character numbers provided by this scanner. The default is 1. */
	public int getTabLength() {
		return theTabLength;
	}

	/**
	 * @param tabLength The number of columns a tab advances the character numbers provided by this scanner
	 * @return This scanner
	 */
	public XmlScanner setTabLength(int tabLength) {
		if (tabLength < 0)
			throw new IllegalArgumentException("Tab length must not be less than zero");
		theTabLength = tabLength;
		return this;
	}

	/** @return The character set the source is decoded with, or null if no event has been requested yet or the source is a reader */
	public Charset getCharset() {
		return theCharset;
	}

	/** @return The version from the XML declaration, or null if there was none (or it has not been read yet) */
	public String getVersion() {
		return theVersion;
	}

	/** @return The encoding name from the XML declaration, or null if none was specified (or it has not been read yet) */
	public String getDeclaredEncoding() {
		return theDeclaredEncoding;
	}

	/** @return The standalone flag from the XML declaration, or null if it was not specified */
	public Boolean isStandalone() {
		return isStandalone;
	}

	/** @return The number of elements currently open in the source */
	public int getDepth() {
		return theOpenElements.size();
	}

	/** @return The '/'-separated names of the elements currently open, empty outside the root element */
	public String getElementPath() {
		StringBuilder str = new StringBuilder();
		Iterator<String> iter = theOpenElements.descendingIterator();
		while (iter.hasNext()) {
			if (str.length() > 0)
				str.append('/');
			str.append(iter.next());
		}
		return str.toString();
	}

	/** @return The position of the next unconsumed character */
	public FilePosition getPosition() {
		return getFilePosition(false);
	}

	/**
	 * Reads the next event from the source. If the source is malformed, every well-formed event before the problem is returned first, then
	 * this method throws. Once it has thrown, every further call throws the same exception.
	 *
	 * @return The next event, or null if the document has ended
	 * @throws IOException If an error occurs reading the source
	 * @throws XmlParseException If the XML is malformed
	 */
	public XmlEvent next() throws IOException, XmlParseException {
		if (theParseFailure != null)
			throw theParseFailure;
		else if (theIOFailure != null)
			throw theIOFailure;
		try {
			return scan();
		} catch (XmlParseException e) {
			theParseFailure = e;
			throw e;
		} catch (IOException e) {
			theIOFailure = e;
			throw e;
		}
	}

	@Override
	public void close() throws IOException {
		theState = State.DONE;
		if (theReader != null)
			theReader.close();
		else
			theStream.close();
	}

	private XmlEvent scan() throws IOException, XmlParseException {
		if (thePendingEnd != null) { // The second half of a self-closing element
			String name = thePendingEnd;
			thePendingEnd = null;
			closeElement();
			return XmlEvent.end(name);
		}
		while (true) {
			if (theChar == DECODE_ERROR)
				throw decodeError();
			XmlEvent event = null;
			switch (theState) {
			case INITIAL:
				initialize();
				theState = State.PROLOG;
				if (theChar == '<') { // The XML declaration may only occur here
					mark();
					advance();
					event = prologMarkup(true);
				}
				break;
			case PROLOG:
				skipWS();
				if (theChar == EOF)
					throwException(false, "No root element found");
				else if (theChar != '<')
					throwException(false, "The first non-whitespace character in an XML document must be '<', not " + describe(theChar));
				mark();
				advance();
				event = prologMarkup(false);
				break;
			case CONTENT:
				if (theChar == EOF)
					throwException(false, "Element '" + theOpenElements.peek() + "' was not closed");
				else if (theChar != '<')
					return parseText();
				mark();
				advance();
				switch (theChar) {
				case '/':
					return parseEndTag();
				case '?':
					skipProcessingInstruction(false);
					break;
				case '!':
					advance();
					if (theChar == '[') {
						String cdata = parseCdata();
						if (cdata.length() > 0)
							event = XmlEvent.text(cdata);
					} else if (theChar == '-')
						skipComment();
					else
						throwException(true, "Misplaced '<' or malformed XML construct");
					break;
				default:
					return parseStartTag();
				}
				break;
			case EPILOG:
				skipWS();
				if (theChar == EOF) {
					theState = State.DONE;
					return null;
				} else if (theChar != '<')
					throwException(false, "Unexpected character in XML after root element");
				mark();
				advance();
				if (theChar == '?')
					skipProcessingInstruction(false);
				else if (theChar == '!') {
					advance();
					if (theChar != '-')
						throwException(true, "Comment expected");
					skipComment();
				} else
					throwException(true, "Unexpected character sequence in XML after root element");
				break;
			case DONE:
				return null;
			}
			if (event != null)
				return event;
		}
	}

	private void initialize() throws IOException, XmlParseException {
		if (theStream != null) {
			BufferedInputStream buffered = XmlEncodingSniffer.buffered(theStream);
			XmlEncodingSniffer.Sniffed sniffed = XmlEncodingSniffer.sniff(buffered);
			theCharset = sniffed.getCharset();
			theByteOffset = sniffed.getBomLength();
			theByteCounter = new ByteCounter(theCharset);
			theReader = new StreamDecoder(buffered, theCharset);
			if (log.isDebugEnabled())
				log.debug("Decoding XML as " + theCharset.name()
					+ (sniffed.getBomLength() > 0 ? " (byte-order mark)" : sniffed.getDeclaredEncoding() != null ? " (declared)" : ""));
		}
		load();
		if (theChar == '\uFEFF' && theStream == null)
			load(); // A byte-order mark decoded by the caller's reader is not content
	}

	/** Handles the markup after a '<' outside the root element, returning the root's start event if that is what it was */
	private XmlEvent prologMarkup(boolean atStart) throws IOException, XmlParseException {
		if (theChar == '?') {
			skipProcessingInstruction(atStart);
			return null;
		} else if (theChar == '!') {
			advance();
			if (theChar == '-')
				skipComment();
			else if (theChar == 'D')
				skipDoctype();
			else
				throwException(true, "'<!' here is expected to be followed by 'DOCTYPE' for a DOCTYPE declaration or '--' for a comment");
			return null;
		}
		theState = State.CONTENT;
		return parseStartTag();
	}

	private XmlEvent parseStartTag() throws IOException, XmlParseException {
		String elementName = getName();
		Map<String, String> attributes = null;
		while (true) {
			boolean whitespace = isWhitespace(theChar);
			if (whitespace)
				skipWS();
			if (theChar == '/') { // Self-closing element
				advance();
				if (theChar != '>')
					throwException(false, "'>' expected");
				advance();
				openElement(elementName);
				thePendingEnd = elementName;
				return XmlEvent.start(elementName, attributes);
			} else if (theChar == '>') {
				advance();
				openElement(elementName);
				return XmlEvent.start(elementName, attributes);
			} else if (theChar == EOF)
				throwException(false, "Unexpected end of XML content");
			else if (!whitespace)
				throwException(false, "White space expected before attribute, not " + describe(theChar));
			// Attribute
			mark();
			String attributeName = getName();
			if (attributes == null)
				attributes = new LinkedHashMap<>();
			else if (attributes.containsKey(attributeName))
				throwException(true, "Multiple '" + attributeName + "' attributes specified on this element");
			int quote = startAttribute();
			attributes.put(attributeName, parseAttributeValue(quote));
		}
	}

	private XmlEvent parseEndTag() throws IOException, XmlParseException {
		advance(); // Past the '/'
		mark();
		String closingElement = getName();
		String elementName = theOpenElements.peek();
		if (!closingElement.equals(elementName))
			throwException(true, "Closing element for '" + elementName + "' expected, not '" + closingElement + "'");
		skipWS();
		if (theChar != '>')
			throwException(false, "'>' expected");
		advance();
		closeElement();
		return XmlEvent.end(closingElement);
	}

	private XmlEvent parseText() throws IOException, XmlParseException {
		theText.setLength(0);
		while (theChar >= 0 && theChar != '<') {
			if (theChar == '&')
				parseEscapeSequence(theText);
			else {
				theText.append((char) theChar);
				advance();
			}
		}
		return XmlEvent.text(theText.toString());
	}

	private String parseCdata() throws IOException, XmlParseException {
		for (int c = 0; c < CDATA_KEYWORD.length(); c++) {
			advance();
			if (theChar != CDATA_KEYWORD.charAt(c))
				throwException(true, "Bad CDATA initializer");
		}
		advance();
		theText.setLength(0);
		while (true) {
			if (theChar == EOF)
				throwException(false, "Unexpected end of XML content");
			theText.append((char) theChar);
			advance();
			int len = theText.length();
			if (len >= 3 && theText.charAt(len - 1) == '>' && theText.charAt(len - 2) == ']' && theText.charAt(len - 3) == ']') {
				theText.setLength(len - 3);
				return theText.toString();
			}
		}
	}

	private void skipComment() throws IOException, XmlParseException {
		advance();
		if (theChar != '-')
			throwException(true, "'<!-' here should be followed by another '-' for a comment");
		advance();
		while (true) {
			if (theChar == EOF)
				throwException(false, "Unexpected end of XML content");
			else if (theChar == '-') {
				advance();
				if (theChar == '-') {
					advance();
					if (theChar != '>')
						throwException(false, "'--' is not allowed in comments");
					advance();
					return;
				}
			} else
				advance();
		}
	}

	private void skipProcessingInstruction(boolean atStart) throws IOException, XmlParseException {
		advance();
		String target = getName();
		if (target.equalsIgnoreCase("xml")) {
			if (atStart && target.equals("xml")) {
				parseXmlDeclaration();
				return;
			} else if (atStart)
				throwException(true, "XML declaration must start with '<?xml'");
			else
				throwException(true, "XML declaration must be at the first position of the first line of the XML document");
		}
		if (!isWhitespace(theChar) && theChar != '?')
			throwException(false, "Processing instruction target must be followed by '?>' or whitespace");
		while (true) {
			if (theChar == EOF)
				throwException(false, "Unexpected end of XML content");
			else if (theChar == '?') {
				advance();
				if (theChar == '>') {
					advance();
					return;
				}
			} else
				advance();
		}
	}

	private void parseXmlDeclaration() throws IOException, XmlParseException {
		if (!isWhitespace(theChar))
			throwException(false, "Expected whitespace after beginning of XML declaration");
		String version = null;
		String encoding = null;
		Boolean standalone = null;
		skipWS();
		while (theChar >= 'a' && theChar <= 'z') {
			mark();
			String attrName = getName();
			switch (attrName) {
			case VERSION:
				if (version != null)
					throwException(true, "Duplicate '" + VERSION + "' attribute on XML declaration");
				break;
			case ENCODING:
				if (encoding != null)
					throwException(true, "Duplicate '" + ENCODING + "' attribute on XML declaration");
				break;
			case STANDALONE:
				if (standalone != null)
					throwException(true, "Duplicate '" + STANDALONE + "' attribute on XML declaration");
				break;
			default:
				throwException(true, "Only '" + VERSION + "', '" + ENCODING + "', or '" + STANDALONE
					+ "' attributes are allowed on the XML declaration, not '" + attrName + "'");
			}
			int quote = startAttribute();
			mark();
			String value = parseAttributeValue(quote);
			switch (attrName) {
			case VERSION:
				version = value;
				break;
			case ENCODING:
				if (XmlEncodingSniffer.forName(value) == null)
					throw new UnsupportedXmlEncodingException("Unsupported character set: " + value, getFilePosition(true), value);
				encoding = value;
				break;
			default:
				switch (value) {
				case "yes":
					standalone = Boolean.TRUE;
					break;
				case "no":
					standalone = Boolean.FALSE;
					break;
				default:
					throwException(true, STANDALONE + " must be 'yes' or 'no', not '" + value + "'");
				}
			}
			if (!isWhitespace(theChar))
				break;
			skipWS();
		}
		if (theChar != '?')
			throwException(false, "XML declaration must end with '?>'");
		advance();
		if (theChar != '>')
			throwException(false, "XML declaration must end with '?>'");
		if (version == null)
			throwException(false, "XML declaration must include the '" + VERSION + "' attribute");
		advance();
		theVersion = version;
		theDeclaredEncoding = encoding;
		isStandalone = standalone;
	}

	private void skipDoctype() throws IOException, XmlParseException {
		for (int c = 0; c < DOCTYPE_KEYWORD.length(); c++) {
			advance();
			if (theChar != DOCTYPE_KEYWORD.charAt(c))
				throwException(true, "'<!DOCTYPE' expected but not found");
		}
		if (hasDoctype)
			throwException(true, "Only one DOCTYPE declaration is allowed");
		hasDoctype = true;
		int quote = 0;
		while (true) {
			advance();
			if (theChar == EOF)
				throwException(false, "Unexpected end of XML content");
			else if (quote != 0) {
				if (theChar == quote)
					quote = 0;
			} else if (theChar == '"' || theChar == '\'')
				quote = theChar;
			else if (theChar == '[')
				throwException(false, "DOCTYPE internal subsets are not supported by this parser");
			else if (theChar == '>') {
				advance();
				return;
			}
		}
	}

	/** Moves past the '="' sequence between an attribute's name and its value, returning the quote character */
	private int startAttribute() throws IOException, XmlParseException {
		skipWS();
		if (theChar != '=')
			throwException(false, "'=' expected");
		advance();
		skipWS();
		if (theChar != '"' && theChar != '\'')
			throwException(false, "'\"' expected");
		int quote = theChar;
		advance();
		return quote;
	}

	private String parseAttributeValue(int quote) throws IOException, XmlParseException {
		theText.setLength(0);
		while (theChar != quote) {
			if (theChar == EOF)
				throwException(false, "Unexpected end of XML content");
			else if (theChar == '<')
				throwException(false, "'<' is not a valid character in an attribute value");
			else if (theChar == '&')
				parseEscapeSequence(theText);
			else {
				// Literal line breaks and tabs are normalized to spaces, character references are not
				theText.append(theChar == '\n' || theChar == '\t' ? ' ' : (char) theChar);
				advance();
			}
		}
		advance(); // Past the closing quote
		return theText.toString();
	}

	private void parseEscapeSequence(StringBuilder target) throws IOException, XmlParseException {
		mark();
		advance();
		if (theChar == '#') {
			advance();
			boolean hex = theChar == 'x';
			if (hex)
				advance();
			int code = 0;
			int count = 0;
			while (true) {
				int digit = hex ? hex(theChar) : (theChar >= '0' && theChar <= '9' ? theChar - '0' : -1);
				if (digit < 0)
					break;
				code = code * (hex ? 16 : 10) + digit;
				if (code > Character.MAX_CODE_POINT)
					throwException(true, (hex ? "Hex" : "Decimal") + " entity is too large--no such character");
				count++;
				advance();
			}
			if (count == 0)
				throwException(false, hex ? "One or more hexadecimal characters expected" : "One or more decimal characters expected");
			else if (theChar != ';')
				throwException(false, "';' expected");
			else if (code == 0 || (code >= Character.MIN_SURROGATE && code <= Character.MAX_SURROGATE))
				throwException(true, "Character reference does not refer to a legal XML character");
			advance();
			target.appendCodePoint(code);
		} else {
			theNameBuffer.setLength(0);
			while (isNameChar(theChar)) {
				theNameBuffer.append((char) theChar);
				advance();
			}
			if (theNameBuffer.length() == 0)
				throwException(false, "Entity name expected");
			else if (theChar != ';')
				throwException(false, "';' expected");
			String entityName = theNameBuffer.toString();
			String content = STANDARD_NAMED_ENTITIES.get(entityName);
			if (content == null)
				throwException(true, "Unrecognized named entity: '" + entityName + "'");
			advance();
			target.append(content);
		}
	}

	/** Parses an XML element or attribute name from the source, starting with the current character */
	private String getName() throws IOException, XmlParseException {
		if (!isNameStart(theChar))
			throwException(false, "Names must start with a letter or underscore, not " + describe(theChar));
		theNameBuffer.setLength(0);
		do {
			theNameBuffer.append((char) theChar);
			advance();
		} while (isNameChar(theChar));
		return theNameBuffer.toString();
	}

	private void skipWS() throws IOException, XmlParseException {
		while (isWhitespace(theChar))
			advance();
	}

	private void openElement(String name) {
		theOpenElements.push(name);
	}

	private void closeElement() {
		theOpenElements.pop();
		if (theOpenElements.isEmpty())
			theState = State.EPILOG;
	}

	/** Consumes the current character and loads the next one */
	private void advance() throws IOException, XmlParseException {
		if (theChar == EOF)
			return;
		else if (theChar == DECODE_ERROR)
			throw decodeError();
		thePosition += theCharSourceLength;
		if (theByteOffset >= 0)
			theByteOffset += theCharBytes;
		if (theChar == '\n') {
			theLineNumber++;
			theCharNumber = 0;
		} else if (theChar == '\t')
			theCharNumber += theTabLength;
		else
			theCharNumber++;
		load();
	}

	/**
	 * Loads the character at the current position, normalizing CR and CRLF to LF. Undecodable input loads as {@link #DECODE_ERROR}, which
	 * is thrown once the cursor must consume or interpret it.
	 */
	private void load() throws IOException, XmlParseException {
		int ch = readSource();
		if (ch < 0) {
			theChar = ch; // EOF or DECODE_ERROR
			theCharSourceLength = 0;
			theCharBytes = 0;
			return;
		}
		theCharSourceLength = 1;
		theCharBytes = countBytes(ch);
		if (ch == '\r') {
			int next = readSource();
			if (next == '\n') {
				theCharSourceLength = 2;
				theCharBytes += countBytes(next);
			} else
				thePushback = next;
			ch = '\n';
		}
		theChar = ch;
	}

	private int readSource() throws IOException, XmlParseException {
		if (thePushback != EOF) {
			int ch = thePushback;
			thePushback = EOF;
			return ch;
		}
		while (theBufferPos == theBufferLen) {
			int read;
			try {
				read = theReader.read(theBuffer, 0, theBuffer.length);
			} catch (CharacterCodingException e) {
				// Reported when the cursor reaches the bad input, after everything decoded before it
				theDecodeError = e;
				return DECODE_ERROR;
			}
			if (read < 0)
				return EOF;
			theBufferPos = 0;
			theBufferLen = read;
		}
		return theBuffer[theBufferPos++];
	}

	private XmlParseException decodeError() {
		String encoding = theCharset == null ? "in the reader's encoding" : theCharset.name();
		XmlParseException ex = new XmlParseException(getElementPath(), "Content is not valid " + encoding + ": " + theDecodeError.getMessage(),
			getFilePosition(false));
		ex.initCause(theDecodeError);
		return ex;
	}

	private int countBytes(int ch) {
		return theByteCounter == null ? 0 : theByteCounter.count((char) ch);
	}

	private void mark() {
		theMarkPosition = thePosition;
		theMarkByteOffset = theByteOffset;
		theMarkLineNumber = theLineNumber;
		theMarkCharNumber = theCharNumber;
	}

	private FilePosition getFilePosition(boolean atMark) {
		if (atMark)
			return new FilePosition(theMarkPosition, theMarkByteOffset, theMarkLineNumber, theMarkCharNumber);
		else
			return new FilePosition(thePosition, theByteOffset, theLineNumber, theCharNumber);
	}

	private void throwException(boolean atMark, String message) throws XmlParseException {
		if (!atMark && theChar == DECODE_ERROR)
			throw decodeError();
		throw new XmlParseException(getElementPath(), message, getFilePosition(atMark));
	}

	private static String describe(int ch) {
		if (ch == EOF)
			return "end of input";
		else if (ch == DECODE_ERROR)
			return "undecodable input";
		return "'" + (char) ch + "'";
	}

	static boolean isWhitespace(int ch) {
		return ch == ' ' || ch == '\n' || ch == '\t' || ch == '\r';
	}

	static boolean isNameStart(int ch) {
		return ch == '_' || ch == ':' || (ch >= 0 && (Character.isLetter(ch) || Character.isSurrogate((char) ch)));
	}

	static boolean isNameChar(int ch) {
		switch (ch) {
		case '-':
		case '_':
		case '.':
		case ':':
			return true;
		default:
			return ch >= 0 && (Character.isLetterOrDigit(ch) || Character.isSurrogate((char) ch) || ch == '\u00B7');
		}
	}

	private static int hex(int ch) {
		if (ch >= '0' && ch <= '9')
			return ch - '0';
		else if (ch >= 'a' && ch <= 'f')
			return ch - 'a' + 10;
		else if (ch >= 'A' && ch <= 'F')
			return ch - 'A' + 10;
		else
			return -1;
	}

	@Override
	public String toString() {
		return "L" + (theLineNumber + 1) + "C" + (theCharNumber + 1) + " " + describe(theChar);
	}

	/**
	 * Decodes a byte stream with a strict {@link CharsetDecoder}. Unlike an {@link java.io.InputStreamReader}, the characters decoded
	 * before malformed or unmappable input are returned first, and the error is thrown by the following read.
	 */
	static class StreamDecoder extends Reader {
		private final InputStream theInput;
		private final CharsetDecoder theDecoder;
		private final ByteBuffer theBytes;
		private boolean isEndOfInput;
		private boolean isFlushed;
		private CharacterCodingException theError;

		StreamDecoder(InputStream input, Charset charset) {
			theInput = input;
			theDecoder = charset.newDecoder()//
				.onMalformedInput(CodingErrorAction.REPORT)//
				.onUnmappableCharacter(CodingErrorAction.REPORT);
			theBytes = ByteBuffer.allocate(8192);
			theBytes.flip();
		}

		@Override
		public int read(char[] cbuf, int off, int len) throws IOException {
			if (len == 0)
				return 0;
			else if (theError != null)
				throw theError;
			else if (isFlushed)
				return EOF;
			CharBuffer out = CharBuffer.wrap(cbuf, off, len);
			while (out.position() == off) {
				CoderResult result = theDecoder.decode(theBytes, out, isEndOfInput);
				if (result.isError()) {
					theError = result.isMalformed() ? new MalformedInputException(result.length())
						: new UnmappableCharacterException(result.length());
					break;
				} else if (out.position() > off || result.isOverflow())
					break;
				else if (isEndOfInput) {
					theDecoder.flush(out);
					isFlushed = true;
					break;
				}
				theBytes.compact();
				int read = theInput.read(theBytes.array(), theBytes.position(), theBytes.remaining());
				if (read < 0)
					isEndOfInput = true;
				else
					theBytes.position(theBytes.position() + read);
				theBytes.flip();
			}
			int decoded = out.position() - off;
			if (decoded > 0)
				return decoded;
			else if (theError != null)
				throw theError;
			else
				return isFlushed ? EOF : 0;
		}

		@Override
		public void close() throws IOException {
			theInput.close();
		}
	}

	/** Counts the encoded length of each decoded character so that positions can carry byte offsets */
	static class ByteCounter {
		private static final int ENCODE = 0;
		private static final int UTF_8 = 1;
		private static final int UTF_16 = 2;
		private static final int SINGLE_BYTE = 3;

		private final int theMode;
		private final CharsetEncoder theEncoder;
		private final CharBuffer theCharBuffer;
		private final ByteBuffer theByteBuffer;

		ByteCounter(Charset charset) {
			CharsetEncoder encoder = charset.canEncode() ? charset.newEncoder() : null;
			if (charset.equals(StandardCharsets.UTF_8))
				theMode = UTF_8;
			else if (charset.equals(StandardCharsets.UTF_16BE) || charset.equals(StandardCharsets.UTF_16LE)
				|| charset.equals(StandardCharsets.UTF_16))
				theMode = UTF_16;
			else if (encoder == null || encoder.maxBytesPerChar() <= 1.0f)
				theMode = SINGLE_BYTE;
			else
				theMode = ENCODE;
			if (theMode == ENCODE) {
				theEncoder = encoder;
				theCharBuffer = CharBuffer.allocate(1);
				theByteBuffer = ByteBuffer.allocate(16);
			} else {
				theEncoder = null;
				theCharBuffer = null;
				theByteBuffer = null;
			}
		}

		int count(char ch) {
			switch (theMode) {
			case UTF_8:
				if (ch < 0x80)
					return 1;
				else if (ch < 0x800)
					return 2;
				else if (Character.isHighSurrogate(ch))
					return 4; // The whole pair
				else if (Character.isLowSurrogate(ch))
					return 0;
				else
					return 3;
			case UTF_16:
				return 2;
			case SINGLE_BYTE:
				return 1;
			default:
				if (Character.isSurrogate(ch))
					return 2;
				theCharBuffer.clear();
				theCharBuffer.put(ch).flip();
				theByteBuffer.clear();
				theEncoder.reset();
				CoderResult result = theEncoder.encode(theCharBuffer, theByteBuffer, true);
				if (result.isError())
					return 1;
				theEncoder.flush(theByteBuffer);
				return theByteBuffer.position();
			}
		}
	}
}
