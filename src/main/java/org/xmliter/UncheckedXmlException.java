package org.xmliter;

import java.io.IOException;

import org.xmliter.io.XmlScanner.XmlParseException;

/** A RuntimeException wrapping the checked failure of an XML pull where the calling API cannot throw it */
public class UncheckedXmlException extends RuntimeException {
	/** @param ex The parse failure to wrap */
	public UncheckedXmlException(XmlParseException ex) {
		super(ex.getMessage(), ex);
	}

	/** @param ex The I/O failure to wrap */
	public UncheckedXmlException(IOException ex) {
		super(ex.getMessage(), ex);
	}

	/** @return The wrapped parse failure, or null if this wraps an I/O failure */
	public XmlParseException getParseException() {
		return getCause() instanceof XmlParseException ? (XmlParseException) getCause() : null;
	}

	/** @return The wrapped I/O failure, or null if this wraps a parse failure */
	public IOException getIOException() {
		return getCause() instanceof IOException ? (IOException) getCause() : null;
	}

	/**
	 * Throws the wrapped exception
	 *
	 * @return Never returns
	 * @throws IOException If this wraps an I/O failure
	 * @throws XmlParseException If this wraps a parse failure
	 */
	public RuntimeException rethrow() throws IOException, XmlParseException {
		if (getCause() instanceof IOException)
			throw (IOException) getCause();
		throw (XmlParseException) getCause();
	}
}
