package io.github.vevoly.petledger.api.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PetRecordTest {

    @Test
    void of_acceptsFullUint32Range() {
        assertThat(PetRecord.of(0, "a", Species.TURTLE).getId()).isZero();
        assertThat(PetRecord.of(PetRecord.MAX_PET_ID, "a", Species.TURTLE).getId()).isEqualTo(4_294_967_295L);
    }

    @Test
    void of_rejectsIdOutsideUint32() {
        assertThatThrownBy(() -> PetRecord.of(-1, "a", Species.TURTLE)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PetRecord.of(PetRecord.MAX_PET_ID + 1, "a", Species.TURTLE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void species_roundTripsThroughWireCode() {
        for (Species species : Species.values()) {
            assertThat(Species.fromCode(species.getCode())).isEqualTo(species);
        }
        assertThat(Species.defaultSpecies()).isEqualTo(Species.TURTLE);
        assertThatThrownBy(() -> Species.fromCode((byte) 9)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void accountId_rejectsBlankAddress() {
        assertThatThrownBy(() -> AccountId.of(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThat(AccountId.of("a")).isLessThan(AccountId.of("b"));
    }
}
