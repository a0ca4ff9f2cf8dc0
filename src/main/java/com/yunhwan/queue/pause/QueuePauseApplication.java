package com.yunhwan.queue.pause;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QueuePauseApplication {

	public static void main(String[] args) {
		SpringApplication.run(QueuePauseApplication.class, args);
	}

}
