package org.tobmap.routing.build;

import java.util.List;

/**
 * Raw way handed over by ingestion.
 *
 * @param id external way id.
 * @param points vertices in recorded order.
 * @param tags way attributes.
 */
public record WayRecord(long id, List<WayPoint> points, WayTags tags) {
    public WayRecord {
        points = points == null ? List.of() : List.copyOf(points);
        tags = tags == null ? WayTags.builder().build() : tags;
    }

    public static WayRecord of(long id, WayTags tags, WayPoint... points) {
        return new WayRecord(id, List.of(points), tags);
    }
}
