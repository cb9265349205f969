package com.example.healthrag;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
public class MemoryControllerTest {

    @Autowired
    MockMvc mvc;

    @Test
    public void unknownOwnerHasNoMemory() throws Exception {
        mvc.perform(get("/api/memory/mc-nobody")).andExpect(status().isNotFound());
        mvc.perform(get("/api/memory/mc-nobody/entries"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    public void appendThenReadEntries() throws Exception {
        mvc.perform(post("/api/memory/mc-user").contentType("application/json")
                        .content("{\"text\":\"Started magnesium\",\"context\":{\"dose_mg\":200}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ownerId").value("mc-user"))
                .andExpect(jsonPath("$.entryCount").value(1));
        mvc.perform(post("/api/memory/mc-user").contentType("application/json").content("{\"text\":\"Stopped coffee\"}"))
                .andExpect(jsonPath("$.entryCount").value(2));

        mvc.perform(get("/api/memory/mc-user/entries"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].content").value("Started magnesium\nContext: dose_mg: 200"))
                .andExpect(jsonPath("$[1].content").value("Stopped coffee"));
    }

    @Test
    public void blankTextIsRejected() throws Exception {
        mvc.perform(post("/api/memory/mc-blank").contentType("application/json").content("{\"text\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }
}
