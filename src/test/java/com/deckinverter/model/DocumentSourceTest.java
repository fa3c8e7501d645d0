package com.deckinverter.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentSourceTest {

    @Test
    void callersCannotChangeAQueuedInput() {
        byte[] bytes = {1, 2, 3};
        DocumentSource source = DocumentSource.of("a.pptx", bytes);

        bytes[0] = 9;
        source.getData()[1] = 9;

        assertThat(source.getData()).containsExactly(1, 2, 3);
        assertThat(source.withName("b.pptx").getData()).containsExactly(1, 2, 3);
    }
}
