package co.fanki.zombies;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Code Zombies Investigator graph core.
 *
 * <p>Builds a cross-repository dependency graph from parser facts, infers
 * the implicit links a plain call graph misses (ORM mappings, stored
 * procedures, scheduler scripts, table access) and reports the code no
 * active root reaches.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class ZombiesApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(ZombiesApplication.class, args);
    }

}
