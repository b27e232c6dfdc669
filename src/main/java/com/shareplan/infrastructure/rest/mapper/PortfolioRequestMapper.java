package com.shareplan.infrastructure.rest.mapper;

import com.shareplan.domain.model.PortfolioEntry;
import com.shareplan.domain.model.PortfolioSnapshot;
import com.shareplan.domain.model.TransactionEntry;
import com.shareplan.domain.usecase.LoadPortfolioUseCase;
import com.shareplan.infrastructure.rest.dto.LoadPortfolioRequest;
import com.shareplan.infrastructure.rest.dto.PortfolioEntryRequest;
import com.shareplan.infrastructure.rest.dto.PortfolioRequest;
import com.shareplan.infrastructure.rest.dto.TransactionRequest;
import org.mapstruct.Mapper;

import java.util.List;

/**
 * MapStruct mapper from load requests to the parsed-file domain inputs
 */
@Mapper(componentModel = "cdi")
public interface PortfolioRequestMapper {

    PortfolioSnapshot toSnapshot(PortfolioRequest request);

    PortfolioEntry toEntry(PortfolioEntryRequest request);

    TransactionEntry toTransaction(TransactionRequest request);

    List<TransactionEntry> toTransactions(List<TransactionRequest> requests);

    default LoadPortfolioUseCase.Command toCommand(LoadPortfolioRequest request) {
        if (request == null) {
            return null;
        }
        return new LoadPortfolioUseCase.Command(
                toSnapshot(request.portfolio()),
                request.transactions() != null ? toTransactions(request.transactions()) : List.of(),
                request.displayCurrency()
        );
    }
}
