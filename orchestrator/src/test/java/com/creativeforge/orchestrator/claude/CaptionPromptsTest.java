package com.creativeforge.orchestrator.claude;

import com.creativeforge.orchestrator.model.OutputLanguage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CaptionPromptsTest {

    @Test
    void system_namesLanguageAndCode() {
        assertThat(CaptionPrompts.system(OutputLanguage.MALAYALAM)).contains("Malayalam").contains("(ml)");
    }

    @Test
    void clean_removesWrappingQuotesOnly() {
        assertThat(CaptionPrompts.clean("  \"Fresh mangoes\"  ")).isEqualTo("Fresh mangoes");
        assertThat(CaptionPrompts.clean("“Fresh mangoes”")).isEqualTo("Fresh mangoes");
        assertThat(CaptionPrompts.clean("Say \"hello\" to mangoes")).isEqualTo("Say \"hello\" to mangoes");
        assertThat(CaptionPrompts.clean(null)).isNull();
    }
}
