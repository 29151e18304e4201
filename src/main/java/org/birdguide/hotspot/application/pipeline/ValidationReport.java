package org.birdguide.hotspot.application.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered PASS/FAIL outcome of validating a published guide.
 *
 * @since 0.1.0
 */
public final class ValidationReport {
  /**
   * One named check.
   *
   * @param name short check name, e.g. {@code species ranks}
   * @param passed whether the check held
   * @param detail summary on success, first violations on failure
   */
  public record Check(String name, boolean passed, String detail) {
    public Check {
      Objects.requireNonNull(name, "name");
      detail = detail == null ? "" : detail;
    }

    /**
     * Renders the check as a single console line.
     *
     * @return {@code PASS name: detail} or {@code FAIL name: detail}
     */
    public String line() {
      return (passed ? "PASS " : "FAIL ") + name + (detail.isEmpty() ? "" : ": " + detail);
    }
  }

  private final String location;
  private final List<Check> checks;

  ValidationReport(String location, List<Check> checks) {
    this.location = Objects.requireNonNull(location, "location");
    this.checks = List.copyOf(checks);
  }

  public String location() {
    return location;
  }

  public List<Check> checks() {
    return checks;
  }

  /**
   * Whether every check passed.
   *
   * @return {@code true} when no check failed
   */
  public boolean passed() {
    return checks.stream().allMatch(Check::passed);
  }

  /**
   * Failed checks in report order.
   *
   * @return failures, possibly empty
   */
  public List<Check> failures() {
    List<Check> failed = new ArrayList<>();
    for (Check check : checks) {
      if (!check.passed()) {
        failed.add(check);
      }
    }
    return failed;
  }

  /**
   * Console lines for every check.
   *
   * @return one line per check
   */
  public List<String> lines() {
    List<String> lines = new ArrayList<>(checks.size());
    for (Check check : checks) {
      lines.add(check.line());
    }
    return lines;
  }
}
