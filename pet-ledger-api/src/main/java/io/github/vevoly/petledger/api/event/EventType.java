package io.github.vevoly.petledger.api.event;

/**
 * <h3>领域事件类型 (Domain Event Type)</h3>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;"><b>Domain Event Type.</b> One per successful command kind.</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public enum EventType {
    PET_MINTED,
    PET_TRANSFERRED,
    PET_FED,
    PET_SLEPT
}
