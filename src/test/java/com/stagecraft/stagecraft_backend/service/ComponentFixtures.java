package com.stagecraft.stagecraft_backend.service;

import com.stagecraft.stagecraft_backend.model.domain.Component;
import com.stagecraft.stagecraft_backend.model.domain.ComponentInput;
import com.stagecraft.stagecraft_backend.model.domain.ComponentOutput;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public final class ComponentFixtures {

    private ComponentFixtures() {}

    public static Component component(String name, String stage, String code) {
        Component c = new Component();
        c.setId(UUID.randomUUID());
        c.setName(name);
        c.setDescription(name + " component");
        c.setCode(code);
        c.setLanguage("python");
        c.setStage(stage);
        c.setInputs(new ArrayList<>(List.of(new ComponentInput("df", "DataFrame", "input frame", true, null))));
        c.setOutput(new ComponentOutput("DataFrame", "result"));
        return c;
    }
}
