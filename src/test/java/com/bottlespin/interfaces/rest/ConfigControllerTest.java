package com.bottlespin.interfaces.rest;

import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ConfigControllerTest {

  @Test
  void exposesClientSettings() throws Exception {
    MockMvc mvc = MockMvcBuilders.standaloneSetup(new ConfigController(2000, 30000)).build();

    mvc.perform(get("/config"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.maxPlayers", is(2)))
        .andExpect(jsonPath("$.roomCodeLength", is(6)))
        .andExpect(jsonPath("$.roomCodeAlphabet", is("ABCDEFGHJKLMNPQRSTUVWXYZ23456789")))
        .andExpect(jsonPath("$.turnChangeDelayMs", is(2000)))
        .andExpect(jsonPath("$.disconnectGraceMs", is(30000)))
        .andExpect(jsonPath("$.protocolVersion", is(1)));
  }
}
