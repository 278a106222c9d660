package com.premiergroup.ad_conversion_hub.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "stored_options")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredOption {

    @Id
    @Column(name = "name", nullable = false, length = 191)
    private String name;

    @Column(name = "option_value", columnDefinition = "TEXT")
    private String value;
}
