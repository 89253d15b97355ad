/* (C)2026 */
package com.ammann.history.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.history.enumeration.AggregateMethod;
import com.ammann.history.enumeration.SeriesShape;
import org.junit.jupiter.api.Test;

class ResultColumnTest {

    @Test
    void columnOfSeriesUsesPathAndMethodParameterName() {
        ScalarSeries series = ScalarSeries.empty(PathSpec.of("navigation.speedOverGround", AggregateMethod.MIDDLE_INDEX));

        ResultColumn column = ResultColumn.of(series);

        assertThat(column.name()).isEqualTo("navigation.speedOverGround");
        assertThat(column.method()).isEqualTo("middle_index");
        assertThat(column.derived("sma").name()).isEqualTo("navigation.speedOverGround.sma");
        assertThat(column.derived("sma").source()).isSameAs(series);
    }

    @Test
    void pathSpecDerivesColumnSafeAlias() {
        PathSpec spec = PathSpec.of("environment.depth.belowKeel", AggregateMethod.MID);

        assertThat(spec.queryResultName()).isEqualTo("environment_depth_belowKeel");
        assertThat(spec.aggregateFunction()).isEqualTo("median");
    }

    @Test
    void seriesReportTheirShape() {
        PathSpec spec = PathSpec.of("navigation.position", AggregateMethod.AVERAGE);

        assertThat(ScalarSeries.empty(spec).shape()).isEqualTo(SeriesShape.SCALAR);
        assertThat(CompositeSeries.empty(spec, ComponentSchema.EMPTY).shape()).isEqualTo(SeriesShape.COMPOSITE);
        assertThat(ScalarSeries.empty(spec).isEmpty()).isTrue();
    }
}
