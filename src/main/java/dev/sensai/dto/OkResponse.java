package dev.sensai.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OkResponse {

    private boolean ok;

    public static OkResponse ok() {
        return new OkResponse(true);
    }
}
