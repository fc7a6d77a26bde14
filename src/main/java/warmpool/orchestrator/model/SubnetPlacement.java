package warmpool.orchestrator.model;

/**
 * A launch target: subnet plus the zone it lives in.
 * Parsed from {@code zone:subnetId}.
 */
public record SubnetPlacement(String zoneId, String subnetId) {

    public static SubnetPlacement parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("subnet placement is empty");
        }
        String v = value.trim();
        int sep = v.lastIndexOf(':');
        if (sep <= 0 || sep == v.length() - 1) {
            throw new IllegalArgumentException("subnet placement must be zone:subnetId, got '" + v + "'");
        }
        return new SubnetPlacement(v.substring(0, sep), v.substring(sep + 1));
    }

    @Override
    public String toString() {
        return zoneId + ":" + subnetId;
    }
}
