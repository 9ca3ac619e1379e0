package github.insight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GitHubInsightApplication {

  public static void main(String[] args) {
    SpringApplication.run(GitHubInsightApplication.class, args);
  }
}
