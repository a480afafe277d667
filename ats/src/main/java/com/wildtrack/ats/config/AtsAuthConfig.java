package com.wildtrack.ats.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Credentials for the ATS web service ({@code auth} action).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AtsAuthConfig {

    @JsonProperty("username")
    private String username;

    @ToString.Exclude
    @JsonProperty("password")
    private String password;
}
