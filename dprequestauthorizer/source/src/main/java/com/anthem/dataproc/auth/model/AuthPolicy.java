package com.anthem.dataproc.auth.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * API Gateway Lambda Authorizer response (IAM Policy).
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthPolicy {

    public static final String POLICY_VERSION = "2012-10-17";
    public static final String INVOKE_ACTION = "execute-api:Invoke";
    
    /**
     * The principal user identifier (token subject, or "anonymous" on deny)
     */
    private String principalId;
    
    /**
     * IAM policy document
     */
    private PolicyDocument policyDocument;
    
    /**
     * Context to pass to the ingestion function. Values must be flat strings.
     */
    private Map<String, Object> context;
    
    /**
     * Usage identifier key (for usage plans)
     */
    private String usageIdentifierKey;

    /**
     * Build the policy enforcing a decision. The statement resource is the exact invoked
     * method ARN; it is never widened.
     */
    public static AuthPolicy from(AuthorizationDecision decision, String usageIdentifierKey) {
        Statement statement = new Statement();
        statement.setAction(INVOKE_ACTION);
        statement.setEffect(decision.getEffect().getValue());
        statement.setResource(decision.getResource());

        PolicyDocument policyDoc = new PolicyDocument();
        policyDoc.setVersion(POLICY_VERSION);
        policyDoc.setStatement(List.of(statement));

        AuthPolicy policy = new AuthPolicy();
        policy.setPrincipalId(decision.getPrincipal());
        policy.setPolicyDocument(policyDoc);
        policy.setContext(Map.copyOf(decision.getContext()));
        policy.setUsageIdentifierKey(usageIdentifierKey != null ? usageIdentifierKey : "");
        return policy;
    }

    @Data
    public static class PolicyDocument {
        @JsonProperty("Version")
        private String version = POLICY_VERSION;
        @JsonProperty("Statement")
        private List<Statement> statement;
    }

    @Data
    public static class Statement {
        @JsonProperty("Action")
        private String action;
        @JsonProperty("Effect")
        private String effect;
        @JsonProperty("Resource")
        private String resource;
    }
}
