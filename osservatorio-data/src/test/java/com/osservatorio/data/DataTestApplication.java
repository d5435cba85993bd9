package com.osservatorio.data;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Boot configuration anchor for slice tests of the data module.
 */
@SpringBootApplication
public class DataTestApplication {
}
