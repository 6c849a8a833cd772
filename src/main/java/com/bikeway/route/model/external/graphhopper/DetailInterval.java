package com.bikeway.route.model.external.graphhopper;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Path detail annotation, serialized by the engine as {@code [fromPointIndex, toPointIndex, value]}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"from", "to", "value"})
public class DetailInterval {
    private int from;
    private int to;
    private String value;
}
