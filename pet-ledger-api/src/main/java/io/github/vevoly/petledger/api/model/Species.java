package io.github.vevoly.petledger.api.model;

/**
 * <h3>宠物物种 (Pet Species)</h3>
 *
 * <p>封闭枚举，编码值与声明顺序一致，一经发布不可调整。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Pet Species.</b> Closed set. Wire codes follow declaration order and must never be reordered.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public enum Species {

    TURTLE((byte) 0),
    SNAKE((byte) 1),
    RABBIT((byte) 2);

    private final byte code;

    Species(byte code) {
        this.code = code;
    }

    public byte getCode() {
        return code;
    }

    /**
     * 根据编码查找物种 (Resolve by wire code).
     *
     * @param code 编码 (Wire code)
     * @return 物种 (Species)
     * @throws IllegalArgumentException 未知编码 / unknown code
     */
    public static Species fromCode(byte code) {
        for (Species species : values()) {
            if (species.code == code) {
                return species;
            }
        }
        throw new IllegalArgumentException("Unknown species code: " + code);
    }

    /**
     * 默认物种 (Default species).
     */
    public static Species defaultSpecies() {
        return TURTLE;
    }
}
