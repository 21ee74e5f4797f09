package io.scanhive.runtime.domain;

/**
 * Finding reported by the persistence agent for a scan.
 */
public record Vulnerability(long id,
                            long scanId,
                            String title,
                            String shortDescription,
                            String riskRating,
                            String cvssV3Vector) {
}
