package com.vidnyan.govern.domain.compliance.catalog;

import com.vidnyan.govern.domain.compliance.Control;
import com.vidnyan.govern.domain.compliance.ControlFramework;
import com.vidnyan.govern.domain.condition.ConditionValidator;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinFrameworksTest {

    @Test
    void all_ShouldShipSixFrameworks() {
        List<String> ids = BuiltinFrameworks.all().stream().map(ControlFramework::id).toList();

        assertEquals(List.of("soc2", "cis", "hipaa", "pci-dss", "gdpr", "nist-800-53"), ids);
    }

    @Test
    void controls_ShouldBeWellFormedAndUniquePerFramework() {
        for (ControlFramework framework : BuiltinFrameworks.all()) {
            Set<String> ids = new HashSet<>();
            for (Control control : framework.controls()) {
                assertTrue(ids.add(control.id()), "duplicate control " + control.id());
                assertFalse(control.applicableResourceTypes().isEmpty(), control.id());
                assertNotNull(control.severity(), control.id());
                assertEquals(List.of(), ConditionValidator.validate(control.predicate(), control.id()));
            }
        }
    }

    @Test
    void categories_ShouldBeDerivedInFirstSeenOrder() {
        ControlFramework soc2 = BuiltinFrameworks.soc2();

        assertEquals(List.of("Data Protection", "Logging & Monitoring", "Access Control", "Change Management"),
                soc2.categories());
    }

    @Test
    void nist_ShouldRequireOwnerAndEnvironmentTags() {
        Control tagging = BuiltinFrameworks.nist80053().findControl("nist-CM-8").orElseThrow();

        assertEquals("Resources must have required tags: owner, environment", tagging.description());
        assertTrue(tagging.appliesTo("serverless-function"));
    }
}
