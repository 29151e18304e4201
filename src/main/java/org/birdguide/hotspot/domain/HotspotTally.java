package org.birdguide.hotspot.domain;

import java.util.Objects;

/**
 * Finalized complete-checklist count of one hotspot.
 *
 * @param hotspot hotspot attributes
 * @param monthlyChecklists distinct complete checklists per month
 */
public record HotspotTally(Hotspot hotspot, MonthlyCounts monthlyChecklists) {
  public HotspotTally {
    Objects.requireNonNull(hotspot, "hotspot");
    Objects.requireNonNull(monthlyChecklists, "monthlyChecklists");
  }

  public String localityId() {
    return hotspot.localityId();
  }

  /**
   * Distinct complete checklists over the whole period.
   *
   * @return checklist count
   */
  public long checklistCount() {
    return monthlyChecklists.total();
  }
}
