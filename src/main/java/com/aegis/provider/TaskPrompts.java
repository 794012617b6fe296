package com.aegis.provider;

import com.aegis.model.TaskType;

/**
 * System instructions sent ahead of the payload, one per task type.
 */
final class TaskPrompts {

    private TaskPrompts() {
    }

    static String systemInstruction(TaskType taskType) {
        return switch (taskType) {
            case VULNERABILITY_ANALYSIS -> "You are a cybersecurity expert specializing in vulnerability analysis. "
                    + "Analyze the provided vulnerability data and provide detailed insights, "
                    + "risk assessment, and remediation recommendations.";
            case THREAT_MODELING -> "You are a threat modeling expert. Analyze the provided system information "
                    + "and identify potential threats, attack vectors, and security recommendations.";
            case SCAN_OPTIMIZATION -> "You are a penetration testing expert. Optimize the scanning parameters "
                    + "based on the target information to improve efficiency and coverage.";
            case REPORT_GENERATION -> "You are a cybersecurity report writer. Generate a comprehensive, "
                    + "professional security assessment report based on the provided data.";
            case EXPLOIT_SUGGESTION -> "You are an ethical penetration testing expert. Suggest potential "
                    + "exploitation techniques for educational and authorized testing purposes only.";
        };
    }
}
