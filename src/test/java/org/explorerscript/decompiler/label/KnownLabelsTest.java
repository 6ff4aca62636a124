package org.explorerscript.decompiler.label;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class KnownLabelsTest {

    @Test
    void nextIdIsZeroWhenEmpty() {
        assertThat(new KnownLabels().nextLabelId()).isZero();
    }

    @Test
    void nextIdIsMaxPlusOne() {
        KnownLabels labels = new KnownLabels();
        labels.put(30, new SsbLabel(4, 0));
        labels.put(10, new SsbLabel(1, 0));

        assertThat(labels.nextLabelId()).isEqualTo(5);
    }

    @Test
    void rejectsSecondLabelForOffset() {
        KnownLabels labels = new KnownLabels();
        labels.put(30, new SsbLabel(0, 0));

        assertThatThrownBy(() -> labels.put(30, new SsbLabel(1, 0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void keepsDiscoveryOrder() {
        KnownLabels labels = new KnownLabels();
        labels.put(90, new SsbLabel(0, 0));
        labels.put(10, new SsbLabel(1, 0));
        labels.put(50, new SsbLabel(2, 1));

        assertThat(labels.asMap().keySet()).containsExactly(90, 10, 50);
    }
}
