package org.xmliter.io;

import java.text.ParseException;

/** A ParseException for multi-line character sequences, located by a {@link FilePosition} */
public class TextParseException extends ParseException {
	private final FilePosition thePosition;

	/**
	 * @param s The message for the exception
	 * @param position The position of the error in the sequence
	 */
	public TextParseException(String s, FilePosition position) {
		super(s, errorOffset(position));
		thePosition = position;
	}

	/**
	 * @param s The message for the exception
	 * @param position The position of the error in the sequence
	 * @param cause The cause of the exception
	 */
	public TextParseException(String s, FilePosition position, Throwable cause) {
		super(s, errorOffset(position));
		initCause(cause);
		thePosition = position;
	}

	/**
	 * @param position The position of an error
	 * @return The character offset of the position for {@link ParseException#getErrorOffset()}, saturated at {@link Integer#MAX_VALUE}
	 */
	static int errorOffset(FilePosition position) {
		if (position == null)
			return 0;
		return (int) Math.min(position.getPosition(), Integer.MAX_VALUE);
	}

	/** @return The position of the source of the error */
	public FilePosition getPosition() {
		return thePosition;
	}

	/** @return The character offset of the error, which unlike {@link #getErrorOffset()} is not limited to the range of an int */
	public long getCharOffset() {
		return thePosition == null ? 0 : thePosition.getPosition();
	}

	/** @return The byte offset of the error, or -1 if the source was read as characters */
	public long getByteOffset() {
		return thePosition == null ? -1 : thePosition.getByteOffset();
	}

	/** @return The line number of the error in the sequence, offset from zero */
	public long getLineNumber() {
		return thePosition == null ? 0 : thePosition.getLineNumber();
	}

	/** @return The character number of the error in the line, offset from zero */
	public long getColumnNumber() {
		return thePosition == null ? 0 : thePosition.getCharNumber();
	}

	@Override
	public String toString() {
		if (thePosition != null)
			return new StringBuilder().append(thePosition).append(":\n").append(super.toString()).toString();
		else
			return super.toString();
	}
}
