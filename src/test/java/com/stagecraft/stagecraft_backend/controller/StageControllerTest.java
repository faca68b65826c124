package com.stagecraft.stagecraft_backend.controller;

import com.stagecraft.stagecraft_backend.service.ComponentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static com.stagecraft.stagecraft_backend.service.ComponentFixtures.component;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class StageControllerTest {

    @Mock
    ComponentService componentService;

    MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new StageController(componentService)).build();
    }

    @Test
    void listsComponentsOfOneStage() throws Exception {
        when(componentService.findByStage("stage3"))
                .thenReturn(List.of(component("Random Forest", "stage3", "def random_forest(X, y): pass")));

        mockMvc.perform(get("/api/v1/stages/stage3/components"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("stage3"))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.components[0].name").value("Random Forest"));
    }

    @Test
    void unknownStageIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/stages/stage7/components"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(componentService);
    }
}
