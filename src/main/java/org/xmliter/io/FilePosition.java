package org.xmliter.io;

/** The position of a single character in an XML source */
public class FilePosition {
	/** The position of the first character of a source with no byte-order mark */
	public static final FilePosition START = new FilePosition(0L, 0L, 0L, 0L);

	private final long thePosition;
	private final long theByteOffset;
	private final long theLineNumber;
	private final long theCharNumber;

	/**
	 * @param position The absolute character position in the source
	 * @param byteOffset The absolute byte offset in the source, or -1 if the source was given as characters
	 * @param lineNumber The line number in the source, indexed from zero
	 * @param charNumber The character number (within the line) in the source, indexed from zero
	 */
	public FilePosition(long position, long byteOffset, long lineNumber, long charNumber) {
		thePosition = position;
		theByteOffset = byteOffset;
		theLineNumber = lineNumber;
		theCharNumber = charNumber;
	}

	/** @return The absolute character position in the source */
	public long getPosition() {
		return thePosition;
	}

	/** @return The absolute byte offset in the source, or -1 if the source was read as characters */
	public long getByteOffset() {
		return theByteOffset;
	}

	/** @return The line number in the source, indexed from zero */
	public long getLineNumber() {
		return theLineNumber;
	}

	/** @return The character number (within the line) in the source, indexed from zero */
	public long getCharNumber() {
		return theCharNumber;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(thePosition);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof FilePosition && thePosition == ((FilePosition) obj).thePosition
			&& theByteOffset == ((FilePosition) obj).theByteOffset;
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder("L").append(theLineNumber + 1).append(",C").append(theCharNumber + 1);
		if (theByteOffset >= 0)
			str.append(" (byte ").append(theByteOffset).append(')');
		return str.toString();
	}
}
