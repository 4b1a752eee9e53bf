package ch.so.arp.rag.hybrid;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

/**
 * REST endpoint adding plain text documents to the caller's corpus.
 */
@RestController
@RequestMapping(path = "/api/ingest", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class IngestController {

    private final IngestService ingestService;
    private final AdmissionControl admissionControl;
    private final RequestContextResolver contextResolver;
    private final RagProperties.Admission admission;

    public IngestController(IngestService ingestService, AdmissionControl admissionControl,
            RequestContextResolver contextResolver, RagProperties properties) {
        this.ingestService = ingestService;
        this.admissionControl = admissionControl;
        this.contextResolver = contextResolver;
        this.admission = properties.getAdmission();
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<IngestResult> ingest(@Valid @RequestBody IngestRequest request,
            HttpServletRequest servletRequest) {
        RequestContext context = contextResolver.resolve(servletRequest);
        servletRequest.setAttribute(RequestContext.class.getName(), context);
        admissionControl.check("ingest", context.tenantId(), admission.getIngestLimit(), admission.getIngestWindow());
        IngestResult result = ingestService.ingest(request, context);
        return ResponseEntity.ok()
                .header(RequestContextResolver.REQUEST_ID_HEADER, context.requestId())
                .body(result);
    }
}
