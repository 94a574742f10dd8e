/*
 * どこで: reminder API
 * 何を: 疎通確認用のルート応答
 */
package com.example.reminder.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "reminder: ok";
  }
}
