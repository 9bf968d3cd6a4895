package io.jobgtm.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.smallrye.mutiny.Uni;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;
import java.util.Map;

@Path("/api")
@RegisterRestClient(configKey = "ollama-api")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public interface OllamaApiClient {

    @POST
    @Path("/generate")
    Uni<GenerateResp> generate(GenerateReq req);

    @GET
    @Path("/tags")
    Uni<TagsResp> tags();

    record GenerateReq(String model, String prompt, boolean stream, Map<String, Object> options) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateResp(String model,
                        String response,
                        Boolean done,
                        @JsonProperty("total_duration") Long totalDuration,
                        @JsonProperty("prompt_eval_count") Integer promptEvalCount,
                        @JsonProperty("eval_count") Integer evalCount) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TagsResp(List<Map<String, Object>> models) { }
}
