package edu.nu.tasktracker.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenPair {
    @JsonProperty("access")
    private String accessToken;

    @JsonProperty("refresh")
    private String refreshToken;
}
