package com.stagecraft.stagecraft_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Reusable piece of pipeline code. {@code code} holds the full function source that gets
 * pasted into generated scripts.
 */
@Entity
@Table(name = "components")
@Data
public class Component {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    private String description;

    @Column(nullable = false, columnDefinition = "text")
    private String code;

    @Column(nullable = false)
    private String language;    // python, javascript, ...

    @Column(nullable = false)
    private String stage;       // stage1 .. stage4

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> tags = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    private List<ComponentInput> inputs = new ArrayList<>();

    @Embedded
    private ComponentOutput output;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }

    @JsonIgnore
    public boolean isValidStage() {
        return stage != null && ComponentTypes.STAGES.contains(stage);
    }

    /** 1..4 for a valid stage, 0 otherwise. */
    @JsonIgnore
    public int getStageNumber() {
        return isValidStage() ? Character.getNumericValue(stage.charAt(stage.length() - 1)) : 0;
    }

    @JsonIgnore
    public boolean hasOutput() {
        return output != null && output.getType() != null && !ComponentTypes.NONE.equals(output.getType());
    }

    @JsonIgnore
    public List<ComponentInput> getRequiredInputs() {
        return inputs == null ? List.of() : inputs.stream().filter(ComponentInput::required).toList();
    }

    @JsonIgnore
    public List<ComponentInput> getOptionalInputs() {
        return inputs == null ? List.of() : inputs.stream().filter(i -> !i.required()).toList();
    }
}
