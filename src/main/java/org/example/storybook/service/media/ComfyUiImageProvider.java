package org.example.storybook.service.media;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Image generation through a ComfyUI server: submit a text-to-image workflow, poll its history
 * until an output image appears, then download the bytes.
 */
@Service
public class ComfyUiImageProvider implements ImageProvider {

  private static final Logger log = LoggerFactory.getLogger(ComfyUiImageProvider.class);
  private static final String NEGATIVE_PROMPT =
      "text, watermark, signature, blurry, bad quality, deformed, ugly, low resolution, scary, violent";

  @Value("${comfyui.base-url:http://localhost:8188}")
  private String comfyuiBaseUrl;

  @Value("${comfyui.workflow-timeout:300000}")
  private long workflowTimeout;

  @Value("${comfyui.poll-interval-ms:2000}")
  private long pollInterval;

  @Value("${comfyui.checkpoint:sd_xl_base_1.0.safetensors}")
  private String checkpoint;

  @Value("${images.width:1024}")
  private int imageWidth;

  @Value("${images.height:768}")
  private int imageHeight;

  @Value("${images.sampler-steps:25}")
  private int samplerSteps;

  @Value("${images.cfg-scale:7}")
  private int cfgScale;

  private WebClient webClient;
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final Random random = new Random();

  @PostConstruct
  public void init() {
    // Larger buffer for image downloads (16MB)
    this.webClient = WebClient.builder()
        .baseUrl(comfyuiBaseUrl)
        .codecs(configurer -> configurer
            .defaultCodecs()
            .maxInMemorySize(16 * 1024 * 1024))
        .build();
    log.info("ComfyUI image provider initialized with endpoint: {}", comfyuiBaseUrl);
  }

  @Override
  public byte[] generate(String prompt, ImageOptions options) {
    if (prompt == null || prompt.isBlank()) {
      throw new ImageGenerationException("Image prompt is empty");
    }
    try {
      String promptId = submitWorkflow(prompt, options);
      return pollForImage(promptId);
    } catch (ImageGenerationException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ImageGenerationException("Interrupted while waiting for ComfyUI", e);
    } catch (Exception e) {
      log.error("ComfyUI image generation failed", e);
      throw new ImageGenerationException("ComfyUI image generation failed: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean isAvailable() {
    try {
      webClient.get()
          .uri("/system_stats")
          .retrieve()
          .bodyToMono(String.class)
          .block(Duration.ofSeconds(3));
      return true;
    } catch (Exception e) {
      log.debug("ComfyUI not available: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public String getProviderName() {
    return "comfyui";
  }

  private String submitWorkflow(String prompt, ImageOptions options) throws Exception {
    ObjectNode requestBody = objectMapper.createObjectNode();
    requestBody.set("prompt", buildWorkflow(prompt, options));

    String response = webClient.post()
        .uri("/prompt")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(objectMapper.writeValueAsString(requestBody))
        .retrieve()
        .bodyToMono(String.class)
        .block(Duration.ofSeconds(10));

    JsonNode promptId = objectMapper.readTree(response).get("prompt_id");
    if (promptId == null || promptId.asText().isBlank()) {
      throw new ImageGenerationException("ComfyUI did not return a prompt_id");
    }
    log.info("Submitted workflow to ComfyUI, prompt_id: {}", promptId.asText());
    return promptId.asText();
  }

  private byte[] pollForImage(String promptId) throws Exception {
    long startTime = System.currentTimeMillis();

    while (System.currentTimeMillis() - startTime < workflowTimeout) {
      String response = webClient.get()
          .uri("/history/{promptId}", promptId)
          .retrieve()
          .bodyToMono(String.class)
          .block(Duration.ofSeconds(5));

      JsonNode promptHistory = objectMapper.readTree(response).get(promptId);
      if (promptHistory != null && !promptHistory.isNull()) {
        JsonNode status = promptHistory.get("status");
        if (status != null && "error".equals(status.path("status_str").asText())) {
          String errorMsg = status.has("messages") ? status.get("messages").toString() : "ComfyUI workflow error";
          throw new ImageGenerationException(errorMsg);
        }

        JsonNode outputs = promptHistory.get("outputs");
        if (outputs != null) {
          for (JsonNode nodeOutput : outputs) {
            JsonNode images = nodeOutput.get("images");
            if (images != null && images.isArray() && images.size() > 0) {
              JsonNode imageInfo = images.get(0);
              return downloadImage(
                  imageInfo.get("filename").asText(),
                  imageInfo.path("subfolder").asText(""));
            }
          }
        }
      }

      Thread.sleep(pollInterval);
    }

    throw new ImageGenerationException("ComfyUI workflow timed out after " + workflowTimeout + "ms");
  }

  private byte[] downloadImage(String filename, String subfolder) {
    byte[] imageData = webClient.get()
        .uri(builder -> {
          builder.path("/view").queryParam("filename", filename);
          if (subfolder != null && !subfolder.isEmpty()) {
            builder.queryParam("subfolder", subfolder);
          }
          return builder.build();
        })
        .retrieve()
        .bodyToMono(byte[].class)
        .block(Duration.ofSeconds(30));

    if (imageData == null || imageData.length == 0) {
      throw new ImageGenerationException("ComfyUI returned an empty image for " + filename);
    }
    log.info("Downloaded image {} ({} bytes)", filename, imageData.length);
    return imageData;
  }

  private ObjectNode buildWorkflow(String positivePrompt, ImageOptions options) {
    int width = options != null && options.width() != null ? options.width() : imageWidth;
    int height = options != null && options.height() != null ? options.height() : imageHeight;
    String prefix = options != null && options.filenamePrefix() != null ? options.filenamePrefix() : "storybook";

    ObjectNode workflow = objectMapper.createObjectNode();
    workflow.set("4", node("CheckpointLoaderSimple", inputs -> inputs.put("ckpt_name", checkpoint)));
    workflow.set("5", node("EmptyLatentImage", inputs -> {
      inputs.put("width", width);
      inputs.put("height", height);
      inputs.put("batch_size", 1);
    }));
    workflow.set("6", node("CLIPTextEncode", inputs -> {
      inputs.put("text", positivePrompt);
      inputs.set("clip", link("4", 1));
    }));
    workflow.set("7", node("CLIPTextEncode", inputs -> {
      inputs.put("text", NEGATIVE_PROMPT);
      inputs.set("clip", link("4", 1));
    }));
    workflow.set("3", node("KSampler", inputs -> {
      inputs.put("seed", random.nextLong() & Long.MAX_VALUE);
      inputs.put("steps", samplerSteps);
      inputs.put("cfg", cfgScale);
      inputs.put("sampler_name", "euler");
      inputs.put("scheduler", "normal");
      inputs.put("denoise", 1.0);
      inputs.set("model", link("4", 0));
      inputs.set("positive", link("6", 0));
      inputs.set("negative", link("7", 0));
      inputs.set("latent_image", link("5", 0));
    }));
    workflow.set("8", node("VAEDecode", inputs -> {
      inputs.set("samples", link("3", 0));
      inputs.set("vae", link("4", 2));
    }));
    workflow.set("9", node("SaveImage", inputs -> {
      inputs.put("filename_prefix", prefix);
      inputs.set("images", link("8", 0));
    }));
    return workflow;
  }

  private ObjectNode node(String classType, Consumer<ObjectNode> inputsWriter) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("class_type", classType);
    ObjectNode inputs = objectMapper.createObjectNode();
    inputsWriter.accept(inputs);
    node.set("inputs", inputs);
    return node;
  }

  private ArrayNode link(String nodeId, int outputIndex) {
    ArrayNode link = objectMapper.createArrayNode();
    link.add(nodeId).add(outputIndex);
    return link;
  }
}
