package ch.so.arp.rag.hybrid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
 * REST endpoint answering questions against the caller's corpus.
 */
@RestController
@RequestMapping(path = "/api/query", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class QueryController {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryController.class);

    private final QueryOrchestrator orchestrator;
    private final AdmissionControl admissionControl;
    private final RequestContextResolver contextResolver;
    private final RagProperties.Admission admission;

    public QueryController(QueryOrchestrator orchestrator, AdmissionControl admissionControl,
            RequestContextResolver contextResolver, RagProperties properties) {
        this.orchestrator = orchestrator;
        this.admissionControl = admissionControl;
        this.contextResolver = contextResolver;
        this.admission = properties.getAdmission();
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request,
            HttpServletRequest servletRequest) {
        RequestContext context = contextResolver.resolve(servletRequest);
        servletRequest.setAttribute(RequestContext.class.getName(), context);
        admissionControl.check("query", context.tenantId(), admission.getQueryLimit(), admission.getQueryWindow());
        LOGGER.debug("Query request {} for tenant {} (k={}, doc={})", context.requestId(), context.tenantId(),
                request.k(), request.docId());
        QueryResponse response = orchestrator.answer(request, context);
        return ResponseEntity.ok()
                .header(RequestContextResolver.REQUEST_ID_HEADER, context.requestId())
                .body(response);
    }
}
