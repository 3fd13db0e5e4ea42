package io.intellixity.quill.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

@SpringBootApplication(exclude = {MongoAutoConfiguration.class})
public class QuillExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(QuillExamplesApplication.class, args);
  }
}
