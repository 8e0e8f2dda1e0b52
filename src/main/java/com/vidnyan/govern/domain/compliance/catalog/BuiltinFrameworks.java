package com.vidnyan.govern.domain.compliance.catalog;

import com.vidnyan.govern.domain.compliance.Control;
import com.vidnyan.govern.domain.compliance.ControlFramework;
import com.vidnyan.govern.domain.condition.BuiltinCustomConditions;
import com.vidnyan.govern.domain.condition.Condition;
import com.vidnyan.govern.domain.model.Severity;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.vidnyan.govern.domain.condition.Condition.allOf;
import static com.vidnyan.govern.domain.condition.Condition.anyOf;
import static com.vidnyan.govern.domain.condition.Condition.fieldEquals;
import static com.vidnyan.govern.domain.condition.Condition.fieldExists;
import static com.vidnyan.govern.domain.condition.Condition.fieldNotEquals;
import static com.vidnyan.govern.domain.condition.Condition.fieldNotIn;
import static com.vidnyan.govern.domain.condition.Condition.not;

/**
 * Frameworks shipped with the engine: SOC 2, CIS, HIPAA, PCI-DSS, GDPR and NIST 800-53.
 * <p>
 * Control predicates read resource metadata and tags. A metadata flag counts as set when it
 * is {@code true} or the string {@code "true"}. GDPR data residency relies on the
 * {@link BuiltinCustomConditions#REGION_APPROVED} custom condition, so the evaluator that
 * runs these frameworks must carry the built-in registry.
 */
public final class BuiltinFrameworks {

    public static final String SOC2 = "soc2";
    public static final String CIS = "cis";
    public static final String HIPAA = "hipaa";
    public static final String PCI_DSS = "pci-dss";
    public static final String GDPR = "gdpr";
    public static final String NIST_800_53 = "nist-800-53";

    private static final String METADATA = "resource.metadata.";
    private static final String TAGS = "resource.tags.";

    private static final Set<String> TAGGABLE_TYPES = Set.of(
            "compute", "storage", "database", "cache", "queue", "cluster", "function",
            "serverless-function", "network", "vpc", "subnet", "load-balancer");

    private BuiltinFrameworks() {
    }

    public static List<ControlFramework> all() {
        return List.of(soc2(), cis(), hipaa(), pciDss(), gdpr(), nist80053());
    }

    public static ControlFramework soc2() {
        return ControlFramework.of(SOC2, "SOC 2 Type II", "2017",
                "Trust Services Criteria for security, availability, processing integrity, confidentiality and privacy.",
                List.of(
                        encryptionAtRest("soc2", "CC6.1"),
                        accessLogging("soc2", "CC7.2"),
                        backupEnabled("soc2", "A1.2"),
                        publicAccessBlocked("soc2", "CC6.6"),
                        control("soc2-CC6.3", "Change tracking enabled",
                                "Infrastructure changes must be tracked for audit.",
                                "Change Management", Severity.MEDIUM,
                                types("compute", "database", "storage", "cluster"),
                                anyOf(flag("change_tracking"), flag("versioning_enabled")),
                                "Enable change tracking or versioning on the resource."),
                        control("soc2-CC6.2", "MFA / strong auth",
                                "Identity resources must enforce multi-factor authentication.",
                                "Access Control", Severity.CRITICAL,
                                types("identity"),
                                flag("mfa_enabled"),
                                "Enable MFA on identity and IAM resources.")));
    }

    public static ControlFramework cis() {
        return ControlFramework.of(CIS, "CIS Benchmarks", "3.0",
                "Center for Internet Security cloud benchmarks.",
                List.of(
                        publicAccessBlocked("cis", "2.1.1"),
                        encryptionAtRest("cis", "2.1.2"),
                        control("cis-1.4", "Key rotation configured",
                                "Encryption keys must be rotated periodically.",
                                "Key Management", Severity.MEDIUM,
                                types("secret", "database", "storage"),
                                anyOf(flag("key_rotation"), present("rotation_period")),
                                "Enable automatic key rotation on a cycle of 90 days or less."),
                        control("cis-4.1", "Unused resources removed",
                                "Resources in 'stopped' or 'unused' status should be reviewed or terminated.",
                                "Asset Management", Severity.LOW,
                                types("compute", "database", "cache", "cluster"),
                                fieldNotIn("resource.status", "stopped", "unused"),
                                "Terminate or decommission unused resources."),
                        control("cis-5.1", "Default VPC not used",
                                "Resources should not use the default VPC.",
                                "Network Security", Severity.MEDIUM,
                                types("vpc", "subnet", "compute"),
                                not(flag("is_default")),
                                "Move resources from the default VPC to a custom VPC."),
                        accessLogging("cis", "3.1")));
    }

    public static ControlFramework hipaa() {
        return ControlFramework.of(HIPAA, "HIPAA", "2013",
                "Health Insurance Portability and Accountability Act technical safeguards.",
                List.of(
                        encryptionAtRest("hipaa", "164.312-a1"),
                        control("hipaa-164.312-e1", "Encryption in transit",
                                "PHI must be encrypted in transit.",
                                "Data Protection", Severity.CRITICAL,
                                types("database", "storage", "compute", "load-balancer", "gateway", "cache"),
                                anyOf(flag("ssl_enabled"), flag("tls_enabled"), flag("encryption_in_transit")),
                                "Enable TLS for all data in transit."),
                        accessLogging("hipaa", "164.312-b"),
                        control("hipaa-164.312-d", "Access controls",
                                "Access to PHI must be restricted to authorized personnel.",
                                "Access Control", Severity.CRITICAL,
                                types("database", "storage", "compute"),
                                anyOf(flag("access_control"), not(flag("public_access"))),
                                "Implement role-based access controls for PHI resources."),
                        backupEnabled("hipaa", "164.308-a7")));
    }

    public static ControlFramework pciDss() {
        return ControlFramework.of(PCI_DSS, "PCI-DSS", "4.0",
                "Payment Card Industry Data Security Standard.",
                List.of(
                        control("pci-1.3", "Network segmentation",
                                "The cardholder data environment must be segmented from other networks.",
                                "Network Security", Severity.CRITICAL,
                                types("vpc", "subnet", "network", "firewall", "security-group"),
                                anyOf(flag("segmented"), present("network_policy")),
                                "Segment the cardholder data environment."),
                        encryptionAtRest("pci", "3.4"),
                        control("pci-8.3", "MFA for remote access",
                                "Multi-factor authentication is required for all remote access.",
                                "Access Control", Severity.CRITICAL,
                                types("identity", "gateway", "compute"),
                                anyOf(flag("mfa_enabled"), flag("mfa_required")),
                                "Enable MFA for remote access to cardholder data."),
                        accessLogging("pci", "10.2"),
                        control("pci-6.6", "Web application firewall",
                                "Public-facing web applications must sit behind a WAF.",
                                "Application Security", Severity.HIGH,
                                types("load-balancer", "gateway", "cdn"),
                                flag("waf_enabled"),
                                "Deploy a web application firewall in front of public-facing apps.")));
    }

    public static ControlFramework gdpr() {
        return ControlFramework.of(GDPR, "GDPR", "2018",
                "EU General Data Protection Regulation technical requirements.",
                List.of(
                        control("gdpr-art32-a", "Data residency compliance",
                                "Personal data must be stored in approved regions.",
                                "Data Residency", Severity.CRITICAL,
                                types("database", "storage", "compute", "cache", "queue"),
                                Condition.custom(BuiltinCustomConditions.REGION_APPROVED, Map.of()),
                                "Move data to a region approved by the data residency policy."),
                        control("gdpr-art30", "Data classification tags",
                                "Resources holding personal data must carry a data classification tag.",
                                "Data Governance", Severity.HIGH,
                                types("database", "storage", "queue"),
                                anyOf(tag("data_classification"), tag("data-classification")),
                                "Add a data_classification tag such as personal, sensitive or public."),
                        encryptionAtRest("gdpr", "art32-b"),
                        control("gdpr-art17", "Retention policy defined",
                                "A data retention period must be defined for right-to-erasure compliance.",
                                "Data Governance", Severity.MEDIUM,
                                types("database", "storage", "queue"),
                                anyOf(present("retention_days"), present("retention_policy")),
                                "Define a data retention policy for the resource.")));
    }

    public static ControlFramework nist80053() {
        return ControlFramework.of(NIST_800_53, "NIST 800-53", "Rev. 5",
                "Security and privacy controls for information systems and organizations.",
                List.of(
                        publicAccessBlocked("nist", "AC-3"),
                        encryptionAtRest("nist", "SC-28"),
                        accessLogging("nist", "AU-2"),
                        backupEnabled("nist", "CP-9"),
                        taggingRequired("nist", "CM-8", "owner", "environment"),
                        control("nist-SI-4", "System monitoring",
                                "Systems must have active monitoring.",
                                "Monitoring", Severity.MEDIUM,
                                types("compute", "database", "cluster", "load-balancer"),
                                anyOf(flag("monitoring_enabled"), present("monitoring_agent")),
                                "Enable system monitoring and alerting."),
                        control("nist-IR-4", "Incident response plan",
                                "Critical systems must have an incident response plan.",
                                "Incident Response", Severity.HIGH,
                                types("compute", "database", "cluster"),
                                anyOf(flag("incident_response_plan"), tag("ir-plan")),
                                "Document an incident response plan and tag the resource with it.")));
    }

    // Controls reused across frameworks

    static Control encryptionAtRest(String prefix, String id) {
        return control(prefix + "-" + id, "Encryption at rest",
                "Resources must have encryption enabled at rest.",
                "Data Protection", Severity.HIGH,
                types("storage", "database", "cache", "queue"),
                anyOf(flag("encrypted"), flag("encryption_enabled"), flag("kms_key_id")),
                "Enable encryption at rest using a KMS key or platform-managed encryption.");
    }

    static Control accessLogging(String prefix, String id) {
        return control(prefix + "-" + id, "Access logging enabled",
                "Resources must have access logging enabled for audit purposes.",
                "Logging & Monitoring", Severity.MEDIUM,
                types("storage", "database", "compute", "load-balancer", "gateway"),
                anyOf(flag("logging_enabled"), flag("access_logging")),
                "Enable access logging on the resource.");
    }

    static Control publicAccessBlocked(String prefix, String id) {
        return control(prefix + "-" + id, "No public access",
                "Resources must not be publicly accessible unless explicitly required.",
                "Access Control", Severity.CRITICAL,
                types("storage", "database", "compute", "cache", "queue", "cluster"),
                allOf(not(flag("public_access")), not(flag("publicly_accessible"))),
                "Disable public access and restrict the resource to private networks.");
    }

    static Control backupEnabled(String prefix, String id) {
        return control(prefix + "-" + id, "Backup enabled",
                "Critical resources must have automated backups configured.",
                "Data Protection", Severity.HIGH,
                types("database", "storage", "compute"),
                anyOf(flag("backup_enabled"), present("backup_retention")),
                "Enable automated backups with an appropriate retention policy.");
    }

    static Control taggingRequired(String prefix, String id, String... requiredTags) {
        String tagList = String.join(", ", requiredTags);
        Condition[] checks = Arrays.stream(requiredTags).map(BuiltinFrameworks::tag).toArray(Condition[]::new);
        return control(prefix + "-" + id, "Required tags present",
                "Resources must have required tags: " + tagList,
                "Configuration Management", Severity.LOW,
                TAGGABLE_TYPES,
                allOf(checks),
                "Add missing tags: " + tagList);
    }

    private static Control control(String id, String title, String description, String category,
                                   Severity severity, Set<String> types, Condition predicate, String remediation) {
        return Control.builder()
                .id(id)
                .title(title)
                .description(description)
                .category(category)
                .severity(severity)
                .applicableResourceTypes(types)
                .predicate(predicate)
                .remediation(remediation)
                .references(List.of())
                .build();
    }

    private static Set<String> types(String... types) {
        return Set.of(types);
    }

    private static Condition flag(String key) {
        return anyOf(fieldEquals(METADATA + key, true), fieldEquals(METADATA + key, "true"));
    }

    /**
     * Metadata key present with a non-null value.
     */
    private static Condition present(String key) {
        return allOf(fieldExists(METADATA + key), fieldNotEquals(METADATA + key, null));
    }

    private static Condition tag(String key) {
        return fieldExists(TAGS + key);
    }
}
