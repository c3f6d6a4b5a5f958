package com.series.writer.service.api.controller;

import com.series.writer.service.api.dto.ApiResponse;
import com.series.writer.service.api.dto.WriteResult;
import com.series.writer.service.config.OpenApiConfig;
import com.series.writer.service.intake.RemoteWriteDecoder;
import com.series.writer.service.intake.SeriesIntakeService;
import com.series.writer.service.model.TimeSeries;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for Prometheus remote-write ingestion.
 *
 * Handles POST /write: decodes the snappy-compressed protobuf body and buffers
 * every series it contains.
 */
@Slf4j
@RestController
@RequestMapping("/write")
@Tag(name = "Remote Write", description = "Prometheus remote-write receiver")
@RequiredArgsConstructor
public class WriteController {

    private final RemoteWriteDecoder decoder;
    private final SeriesIntakeService intakeService;

    /**
     * Accepts a remote-write request.
     *
     * @param body snappy-compressed prometheus.WriteRequest
     * @return 200 with the accepted series count, 400 if the body cannot be decoded
     */
    @PostMapping
    @Operation(
            summary = "Write time series",
            description = "Accepts a snappy-compressed Prometheus WriteRequest. Series are buffered in memory, "
                    + "staged to files and bulk loaded asynchronously."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Series buffered"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400",
                    ref = "#/components/responses/" + OpenApiConfig.DECODE_ERROR_RESPONSE)
    })
    public ResponseEntity<ApiResponse<WriteResult>> write(@RequestBody(required = false) byte[] body) {
        List<TimeSeries> series = decoder.decode(body);
        int accepted = intakeService.accept(series);
        WriteResult result = new WriteResult(accepted, intakeService.bufferedRecords());

        log.debug("Remote write accepted: {} series, {} buffered", result.acceptedSeries(), result.bufferedRecords());
        return ResponseEntity.ok(ApiResponse.success(result));
    }
}
