package io.arbor.settings;

/**
 * Holding all byte representations for building up markup text.
 */
public enum CharsForSerializing {

  /** " ". */
  SPACE(" "),

  /** "&lt;". */
  OPEN("<"),

  /** "&gt;". */
  CLOSE(">"),

  /** "=\"". */
  EQUAL_QUOTE("=\""),

  /** "\"". */
  QUOTE("\""),

  /** "&lt;/". */
  OPEN_SLASH("</"),

  /** "/&gt;". */
  SLASH_CLOSE("/>"),

  /** ":". */
  COLON(":"),

  /** " xmlns=\"". */
  XMLNS(" xmlns=\""),

  /** " xmlns:". */
  XMLNS_COLON(" xmlns:"),

  /** "xml:". */
  XML_COLON("xml:"),

  /** "&lt;!--". */
  OPENCOMMENT("<!--"),

  /** "--&gt;". */
  CLOSECOMMENT("-->"),

  /** "&lt;?". */
  OPENPI("<?"),

  /** "?&gt;". */
  CLOSEPI("?>"),

  /** "&amp;amp;". */
  AMPERSAND_ENTITY("&amp;"),

  /** "&amp;lt;". */
  LESS_THAN_ENTITY("&lt;"),

  /** "&amp;gt;". */
  GREATER_THAN_ENTITY("&gt;"),

  /** "&amp;quot;". */
  QUOTE_ENTITY("&quot;");

  /** The chars. */
  private final String chars;

  /** Getting the bytes for the chars. */
  private final byte[] bytes;

  /**
   * Private constructor.
   *
   * @param chars the chars
   */
  CharsForSerializing(final String chars) {
    this.chars = chars;
    bytes = chars.getBytes(Constants.DEFAULT_ENCODING);
  }

  public String getChars() {
    return chars;
  }

  /**
   * Getting the bytes.
   *
   * @return the bytes for the chars
   */
  public byte[] getBytes() {
    return bytes.clone();
  }
}
