package org.operaton.fitjourney.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.operaton.fitjourney.model.converter.IsoDateTimeConverter;

import java.time.LocalDateTime;

/**
 * User entity representing the locally signed-in account.
 * The id is the opaque identifier issued by the external auth provider.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    @Column(name = "user_id")
    private String id;

    @Column(name = "first_name", nullable = false)
    private String firstName;

    @Column(name = "last_name", nullable = false)
    private String lastName;

    /**
     * Height in centimetres. Optional; positive when present.
     */
    @Column(name = "height_cm")
    private Double heightCm;

    @Convert(converter = IsoDateTimeConverter.class)
    @Column(name = "registration_date")
    private LocalDateTime registrationDate;

    @Convert(converter = IsoDateTimeConverter.class)
    @Column(name = "last_login")
    private LocalDateTime lastLogin;
}
