package com.phillippitts.genesis;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {
        "genesis.hardware.simulated=true", // no robot needed in tests
        "genesis.hardware.poll-interval-ms=20",
        "genesis.dialogue.greeting-enabled=false",
        "genesis.dialogue.interaction-log-path=target/test-logs/interactions.log",
        "genesis.storage.path=target/test-data/genesis-store.json",
        "genesis.reasoning.api-key="
    }
)
class GenesisApplicationTests {

    @Test
    void contextLoads() {
    }

}
