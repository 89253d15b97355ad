/* (C)2026 */
package com.ammann.history.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class AggregateMethodTest {

    @ParameterizedTest
    @EnumSource(AggregateMethod.class)
    void parameterNameRoundTrips(AggregateMethod method) {
        assertThat(AggregateMethod.fromParameter(method.parameterName())).contains(method);
    }

    @Test
    void unknownOrDifferentlyCasedNamesAreNotRecognised() {
        assertThat(AggregateMethod.fromParameter("sum")).isEmpty();
        assertThat(AggregateMethod.fromParameter("Average")).isEmpty();
        assertThat(AggregateMethod.fromParameter(null)).isEmpty();
    }

    @Test
    void nonNumericComponentsAlwaysUseFirst() {
        assertThat(AggregateMethod.MAX.forComponent(ComponentDataType.STRING)).isEqualTo(AggregateMethod.FIRST);
        assertThat(AggregateMethod.LAST.forComponent(ComponentDataType.BOOLEAN)).isEqualTo(AggregateMethod.FIRST);
        assertThat(AggregateMethod.MAX.forComponent(ComponentDataType.NUMERIC)).isEqualTo(AggregateMethod.MAX);
        assertThat(AggregateMethod.MIDDLE_INDEX.forComponent(ComponentDataType.NUMERIC))
                .isEqualTo(AggregateMethod.FIRST);
    }
}
