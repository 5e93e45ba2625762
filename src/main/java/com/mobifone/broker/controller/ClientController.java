package com.mobifone.broker.controller;

import com.mobifone.broker.common.LogApi;
import com.mobifone.broker.dto.response.ResultEnvelope;
import com.mobifone.broker.service.connection.ConnectionRequestRouter;
import com.mobifone.broker.utils.RequestInfo;
import jakarta.servlet.http.HttpServletRequest;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

/** Entry point for the client launcher opening a link issued by /connection/{service}/{transport}/udslink. */
@RestController
@RequestMapping("/client")
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class ClientController {
    ConnectionRequestRouter connectionRequestRouter;

    @LogApi
    @GetMapping("/{ticketId}/{scrambler}")
    public ResultEnvelope redeem(HttpServletRequest request,
                                 @PathVariable String ticketId,
                                 @PathVariable String scrambler,
                                 @RequestParam(required = false) String hostname) {
        return connectionRequestRouter.redeemLink(ticketId, scrambler, hostname,
                RequestInfo.clientOs(request), RequestInfo.clientIp(request));
    }
}
