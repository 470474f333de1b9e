package com.ammann.randomness.enumeration;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportFormatTest
{

    @ParameterizedTest
    @CsvSource({
            "verbose,VERBOSE",
            "TERSE,TERSE",
            "Terse,TERSE"
    })
    void parsesNamesCaseInsensitively(String value, ReportFormat expected)
    {
        assertThat(ReportFormat.fromString(value)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"csv", "json"})
    void rejectsUnknownNames(String value)
    {
        assertThatThrownBy(() -> ReportFormat.fromString(value))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
