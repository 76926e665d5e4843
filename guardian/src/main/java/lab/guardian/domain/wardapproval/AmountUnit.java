package lab.guardian.domain.wardapproval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AmountUnit {
    TONGO_UNITS("tongo_units"),
    ERC20_WEI("erc20_wei"),
    ERC20_DISPLAY("erc20_display");

    private final String wireName;

    AmountUnit(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AmountUnit fromWire(String value) {
        for (AmountUnit unit : values()) {
            if (unit.wireName.equals(value)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("unknown amount unit: " + value);
    }
}
