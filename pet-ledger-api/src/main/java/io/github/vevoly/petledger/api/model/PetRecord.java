package io.github.vevoly.petledger.api.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.Value;

import java.io.Serial;
import java.io.Serializable;

/**
 * <h3>宠物记录 (Pet Record)</h3>
 *
 * <p>
 * 铸造后不可变。转移只改变持有者，不改变记录本身。
 * {@code id} 为无符号 32 位整数，用 long 承载。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Pet Record.</b><br>
 * Immutable once minted. A transfer changes the owning key only, never the record.
 * {@code id} is an unsigned 32-bit integer carried in a long.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@NoArgsConstructor(force = true, access = AccessLevel.PRIVATE)
public class PetRecord implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * 宠物 ID 的最大值 (2^32 - 1).
     * <br><span style="color: gray;">Maximum pet id (2^32 - 1).</span>
     */
    public static final long MAX_PET_ID = 0xFFFF_FFFFL;

    long id;
    String name;
    Species species;

    public static PetRecord of(long id, String name, Species species) {
        return new PetRecord(requireValidId(id),
                requireNonNull(name, "name"),
                requireNonNull(species, "species"));
    }

    /**
     * 校验宠物 ID 是否位于 uint32 范围 (Validate uint32 range).
     *
     * @param id 宠物 ID (Pet id)
     * @return 原值 (The same id)
     */
    public static long requireValidId(long id) {
        if (id < 0 || id > MAX_PET_ID) {
            throw new IllegalArgumentException("Pet id out of uint32 range: " + id);
        }
        return id;
    }

    private static <T> T requireNonNull(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("Pet " + field + " must not be null");
        }
        return value;
    }
}
