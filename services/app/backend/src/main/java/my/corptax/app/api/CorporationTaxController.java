package my.corptax.app.api;

import jakarta.validation.Valid;
import my.corptax.app.dto.CorporationTaxRequestDto;
import my.corptax.app.dto.CorporationTaxResponseDto;
import my.corptax.app.dto.TaxYearDto;
import my.corptax.app.model.EngineRun;
import my.corptax.app.service.CorporationTaxService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/corporation-tax")
public class CorporationTaxController {
	private final CorporationTaxService corporationTaxService;

	public CorporationTaxController(CorporationTaxService corporationTaxService) {
		this.corporationTaxService = corporationTaxService;
	}

	@PostMapping("/compute")
	public CorporationTaxResponseDto compute(@Valid @RequestBody CorporationTaxRequestDto request) {
		EngineRun run = corporationTaxService.compute(request);
		return new CorporationTaxResponseDto(run.normalizedInput(), run.result());
	}

	@PostMapping("/ct600")
	public Map<String, Object> ct600(@Valid @RequestBody CorporationTaxRequestDto request) {
		return corporationTaxService.computeCt600(request);
	}

	@GetMapping("/tax-years")
	public List<TaxYearDto> taxYears() {
		return corporationTaxService.listTaxYears();
	}
}
