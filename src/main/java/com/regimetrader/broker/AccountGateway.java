package com.regimetrader.broker;

import com.regimetrader.domain.model.AccountInfo;

public interface AccountGateway {

    AccountInfo getAccountInfo();
}
