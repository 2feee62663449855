package com.hardware.cdc.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ClockDomainDeriverTest {

    private final ClockDomainDeriver deriver = new ClockDomainDeriver();

    @Test
    void testGroupsRegistersByClock() {
        List<ClockDomain> domains = deriver.derive(CrossingClassifierTest.build("""
                module m;
                    reg z_q, a_q, b_q, comb;
                    always @(posedge clk_b) b_q <= 1'b0;
                    always @(posedge clk_a) begin
                        z_q <= b_q;
                        a_q <= z_q;
                    end
                    always @* comb = a_q;
                endmodule
                """));

        assertThat(domains).extracting(ClockDomain::getName).containsExactly("clk_a", "clk_b");
        assertThat(domains.get(0).getRegisters()).containsExactly("a_q", "z_q");
        assertThat(domains.get(1).getRegisters()).containsExactly("b_q");
    }

    @Test
    void testDomainsSpanModules() {
        List<ClockDomain> domains = deriver.derive(CrossingClassifierTest.build("""
                module a; reg x; always @(posedge clk) x <= 1'b1; endmodule
                module b; reg y, x; always @(posedge clk) begin y <= 1'b0; x <= y; end endmodule
                """));

        assertThat(domains).singleElement().satisfies(domain -> {
            assertThat(domain.getName()).isEqualTo("clk");
            assertThat(domain.getRegisters()).containsExactly("x", "y");
        });
    }

    @Test
    void testNoClockedRegisters() {
        assertThat(deriver.derive(CrossingClassifierTest.build("module m; reg y; always @* y = a; endmodule")))
                .isEmpty();
    }
}
