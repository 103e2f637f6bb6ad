package com.phillippitts.figuredbass;

import com.phillippitts.figuredbass.domain.FiguredBassLine;
import com.phillippitts.figuredbass.service.chain.Chain;
import com.phillippitts.figuredbass.service.realize.FiguredBassRealizer;
import com.phillippitts.figuredbass.service.voice.StandardVoices;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@SpringBootTest(
    properties = {
        "figuredbass.engine.parallel=true",
        "figuredbass.demo.line=C3 | G2 | C3",
        "figuredbass.demo.samples=1"
    }
)
class FiguredBassApplicationTests {

    @Autowired
    private FiguredBassRealizer realizer;

    @Test
    void contextLoads() {
    }

    @Test
    void shouldRealizeThroughConfiguredPool() {
        Chain chain = realizer.realize(FiguredBassLine.parse("C3 | G2 | C3"), StandardVoices.satb());

        assertThat(chain.count()).isEqualTo(BigInteger.valueOf(76));
    }
}
