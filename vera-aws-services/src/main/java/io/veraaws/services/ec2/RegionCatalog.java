package io.veraaws.services.ec2;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static region and availability-zone catalog. Every region exposes three zones, {@code a} to {@code c}.
 */
final class RegionCatalog {

    static final List<String> REGIONS = List.of(
            "us-east-1", "us-east-2", "us-west-1", "us-west-2",
            "ca-central-1", "sa-east-1",
            "eu-west-1", "eu-west-2", "eu-west-3", "eu-central-1", "eu-north-1",
            "ap-south-1", "ap-northeast-1", "ap-northeast-2", "ap-southeast-1", "ap-southeast-2");

    private static final String ZONE_LETTERS = "abc";

    private static final Map<String, String> DIRECTIONS = Map.of(
            "east", "e", "west", "w", "north", "n", "south", "s", "central", "c",
            "northeast", "ne", "northwest", "nw", "southeast", "se", "southwest", "sw");

    record Zone(String name, String id, String region) {}

    private RegionCatalog() {}

    static String endpoint(String region) {
        return "ec2." + region + ".amazonaws.com";
    }

    static List<Zone> zones(String region) {
        List<Zone> out = new ArrayList<>(ZONE_LETTERS.length());
        for (int i = 0; i < ZONE_LETTERS.length(); i++) {
            out.add(new Zone(region + ZONE_LETTERS.charAt(i), zoneIdPrefix(region) + "-az" + (i + 1), region));
        }
        return out;
    }

    static boolean isZone(String region, String zoneName) {
        for (Zone z : zones(region)) {
            if (z.name().equals(zoneName)) return true;
        }
        return false;
    }

    static String zoneId(String region, String zoneName) {
        for (Zone z : zones(region)) {
            if (z.name().equals(zoneName)) return z.id();
        }
        return zoneIdPrefix(region) + "-az1";
    }

    /** {@code us-east-1} becomes {@code use1}, {@code ap-southeast-2} becomes {@code apse2}. */
    static String zoneIdPrefix(String region) {
        String[] parts = region.toLowerCase(Locale.ROOT).split("-");
        if (parts.length != 3) return region.replace("-", "");
        return parts[0] + DIRECTIONS.getOrDefault(parts[1], parts[1].substring(0, 1)) + parts[2];
    }
}
