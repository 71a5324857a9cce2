package io.shogun.api.shipping;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.shogun.api.audit.AuditService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webmvc.test.autoconfigure.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ShippingStatusController.class)
class ShippingStatusControllerTest {

  @Autowired private MockMvc mockMvc;
  @MockitoBean private LogShippingQueue shippingQueue;
  @MockitoBean private AuditService auditService;

  @Test
  void getStatus_reportsShipperState() throws Exception {
    when(shippingQueue.getStatus()).thenReturn(new ShippingStatus(true, false, 0));

    mockMvc
        .perform(get("/api/audit-logs/shipping/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enabled").value(true))
        .andExpect(jsonPath("$.configured").value(false))
        .andExpect(jsonPath("$.queueSize").value(0));
  }
}
