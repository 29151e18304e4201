package org.birdguide.hotspot.domain;

/** Sample-size tier attached to every occurrence rate. */
public enum Confidence {
  HIGH("high"),
  MEDIUM("medium"),
  LOW("low");

  private final String wireValue;

  Confidence(String wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * Returns the value written to guide files.
   *
   * @return {@code "high"}, {@code "medium"} or {@code "low"}
   */
  public String wireValue() {
    return wireValue;
  }
}
