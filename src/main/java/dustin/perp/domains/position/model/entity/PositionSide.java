package dustin.perp.domains.position.model.entity;

/**
 * 포지션 방향
 * Position side
 */
public enum PositionSide {
    LONG("long"),
    SHORT("short");

    private final String value;

    PositionSide(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public PositionSide opposite() {
        return this == LONG ? SHORT : LONG;
    }

    public static PositionSide fromValue(String value) {
        for (PositionSide side : values()) {
            if (side.value.equalsIgnoreCase(value)) {
                return side;
            }
        }
        throw new IllegalArgumentException("Unknown position side: " + value);
    }
}
