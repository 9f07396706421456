package com.whisperecho.gate.springboot.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whisperecho.gate.server.gate.AuthorizationGate;
import com.whisperecho.gate.springboot.config.GateProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class GateWebConfig implements WebMvcConfigurer {

  private final AuthorizationGate gate;
  private final ObjectMapper objectMapper;
  private final GateProperties props;

  public GateWebConfig(AuthorizationGate gate, ObjectMapper objectMapper, GateProperties props) {
    this.gate = gate;
    this.objectMapper = objectMapper;
    this.props = props;
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(new GateAuthorizationInterceptor(gate, objectMapper, props.getRealm()));
  }
}
