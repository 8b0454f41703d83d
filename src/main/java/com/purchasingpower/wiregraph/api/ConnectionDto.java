package com.purchasingpower.wiregraph.api;

import com.purchasingpower.wiregraph.core.Connection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One connection as returned by the API.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionDto {

    private String fromId;
    private String fromPin;
    private String toId;
    private String toPin;
    private String wireDm;
    private String wireColor;

    public static ConnectionDto from(Connection connection) {
        return ConnectionDto.builder()
            .fromId(connection.getFromId())
            .fromPin(connection.getFromPin())
            .toId(connection.getToId())
            .toPin(connection.getToPin())
            .wireDm(connection.getWireDm())
            .wireColor(connection.getWireColor())
            .build();
    }
}
