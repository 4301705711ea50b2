package com.example.meetingscheduler.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A person that can be invited. The email is the identity key.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParticipantIdentity {

    public static final String EXTERNAL = "External";

    @EqualsAndHashCode.Include
    private String email;
    private String displayName;
    private String department;
    private String title;
    private AvailabilityStatus availabilityStatus = AvailabilityStatus.UNKNOWN;

    public static ParticipantIdentity of(String email, String displayName) {
        return new ParticipantIdentity(email, displayName, null, null, AvailabilityStatus.UNKNOWN);
    }

    public static ParticipantIdentity external(String email, String displayName) {
        return new ParticipantIdentity(email, displayName, EXTERNAL, EXTERNAL, AvailabilityStatus.UNKNOWN);
    }

    @JsonIgnore
    public boolean isExternal() {
        return EXTERNAL.equals(department);
    }
}
