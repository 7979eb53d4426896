package com.newsletter.subscription.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class GreetController {

  private static final String DEFAULT_NAME = "World";

  @GetMapping(
      value = {"/greet", "/greet/{name}"},
      produces = MediaType.TEXT_PLAIN_VALUE)
  public String greet(@PathVariable(name = "name", required = false) String name) {
    return "Hello " + (name == null ? DEFAULT_NAME : name);
  }
}
