package lab.commentsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CommentSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommentSearchApplication.class, args);
    }

}
