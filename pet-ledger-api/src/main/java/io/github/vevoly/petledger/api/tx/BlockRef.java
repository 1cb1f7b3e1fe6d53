package io.github.vevoly.petledger.api.tx;

import lombok.Value;

import java.io.Serial;
import java.io.Serializable;

/**
 * 区块引用 (Block reference): 高度 + 哈希 / height + hash.
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class BlockRef implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    long height;
    String hash;

    @Override
    public String toString() {
        return "#" + height + " (" + hash + ")";
    }
}
