package com.stagecraft.stagecraft_backend.model.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ComponentOutput {

    // one of ComponentTypes.OUTPUT_TYPES; "none" means the component returns nothing
    @Column(name = "output_type")
    private String type;

    @Column(name = "output_description")
    private String description;
}
